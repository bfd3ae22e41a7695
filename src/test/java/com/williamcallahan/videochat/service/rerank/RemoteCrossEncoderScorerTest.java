package com.williamcallahan.videochat.service.rerank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.williamcallahan.videochat.config.AppProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

/**
 * Verifies the cross-encoder HTTP contract and score alignment.
 */
class RemoteCrossEncoderScorerTest {

    private MockRestServiceServer server;
    private RemoteCrossEncoderScorer scorer;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRerank().setBaseUrl("http://reranker.test/");
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        scorer = new RemoteCrossEncoderScorer(appProperties, new RestTemplateBuilder(customizer));
        server = customizer.getServer();
    }

    @Test
    void alignsScoresByIndex() {
        server.expect(requestTo("http://reranker.test/rerank"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"query\":\"q\",\"texts\":[\"one\",\"two\"]}"))
                .andRespond(withSuccess(
                        "[{\"index\":1,\"score\":0.9},{\"index\":0,\"score\":0.2}]", MediaType.APPLICATION_JSON));

        List<Double> scores = scorer.score("q", List.of("one", "two"));

        assertEquals(List.of(0.2, 0.9), scores);
        server.verify();
    }

    @Test
    void missingScoresAreRejected() {
        server.expect(requestTo("http://reranker.test/rerank"))
                .andRespond(withSuccess("[{\"index\":0,\"score\":0.2}]", MediaType.APPLICATION_JSON));

        assertThrows(RerankingFailureException.class, () -> scorer.score("q", List.of("one", "two")));
    }

    @Test
    void serverErrorBecomesRerankingFailure() {
        server.expect(requestTo("http://reranker.test/rerank")).andRespond(withServerError());

        assertThrows(RerankingFailureException.class, () -> scorer.score("q", List.of("one")));
    }
}
