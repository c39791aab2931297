package com.example.hazardrisk.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.http.HttpHost;
import org.elasticsearch.client.Node;
import org.elasticsearch.client.RestClient;
import org.junit.jupiter.api.Test;

class ElasticsearchConfigTest {

    private final ElasticsearchConfig config = new ElasticsearchConfig();

    @Test
    void singleNodeUrl() {
        assertThat(ElasticsearchConfig.parseHosts("https://search.internal:9243"))
                .containsExactly(new HttpHost("search.internal", 9243, "https"));
    }

    @Test
    void commaSeparatedNodesWithDefaults() {
        assertThat(ElasticsearchConfig.parseHosts(" http://es1:9200, es2 ,,http://es3"))
                .containsExactly(
                        new HttpHost("es1", 9200, "http"),
                        new HttpHost("es2", 9200, "http"),
                        new HttpHost("es3", 9200, "http"));
    }

    @Test
    void blankOrHostlessUrlIsRejected() {
        assertThatThrownBy(() -> ElasticsearchConfig.parseHosts("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElasticsearchConfig.parseHosts(" , "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElasticsearchConfig.parseHosts("http:///osha"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http:///osha");
    }

    @Test
    void restClientTargetsEveryConfiguredNode() throws Exception {
        try (RestClient client = config.incidentIndexRestClient(
                "http://es1:9200,http://es2:9201", "reader", "secret", 1000, 2000)) {
            assertThat(client.getNodes()).extracting(Node::getHost).containsExactly(
                    new HttpHost("es1", 9200, "http"),
                    new HttpHost("es2", 9201, "http"));
        }
    }
}
