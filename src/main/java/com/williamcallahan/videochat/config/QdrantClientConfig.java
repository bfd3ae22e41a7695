package com.williamcallahan.videochat.config;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared gRPC client for the transcript vector collection.
 */
@Configuration
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    private static final long KEEPALIVE_SECONDS = 30;
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    private static final long IDLE_MINUTES = 5;

    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient(AppProperties appProperties) {
        AppProperties.Qdrant settings = appProperties.getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={}, collection={})",
                settings.getHost(), settings.getPort(), settings.isUseTls(), settings.getCollection());

        QdrantGrpcClient.Builder grpcClient = QdrantGrpcClient.newBuilder(channel(settings), true);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            grpcClient.withApiKey(settings.getApiKey());
        }
        return new QdrantClient(grpcClient.build());
    }

    // Hosted Qdrant sits behind load balancers that drop idle HTTP/2 connections.
    private static ManagedChannel channel(AppProperties.Qdrant settings) {
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(settings.getHost(), settings.getPort())
                .keepAliveTime(KEEPALIVE_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_MINUTES, TimeUnit.MINUTES);
        if (settings.isUseTls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return builder.build();
    }
}
