package com.williamcallahan.videochat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VideoChatApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) for the shaded gRPC transport used by Qdrant
        System.setProperty("io.grpc.netty.shaded.io.netty.handler.ssl.noOpenSsl", "true");
        SpringApplication.run(VideoChatApplication.class, args);
    }

}
