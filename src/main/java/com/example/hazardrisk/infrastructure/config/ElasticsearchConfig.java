package com.example.hazardrisk.infrastructure.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lexical index client and the pool the retrieval passes run on.
 * <p>
 * {@code hazardrisk.elasticsearch.url} takes one node or a comma-separated list.
 * Basic auth is applied only when a username is set.
 */
@Configuration
public class ElasticsearchConfig {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchConfig.class);

    @Bean(destroyMethod = "close")
    public RestClient incidentIndexRestClient(
            @Value("${hazardrisk.elasticsearch.url}") String urls,
            @Value("${hazardrisk.elasticsearch.username:}") String username,
            @Value("${hazardrisk.elasticsearch.password:}") String password,
            @Value("${hazardrisk.elasticsearch.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${hazardrisk.elasticsearch.socket-timeout-ms}") int socketTimeoutMs
    ) {
        HttpHost[] hosts = parseHosts(urls);
        boolean auth = username != null && !username.isBlank();

        log.info("event=incident_index_client_config nodes={} auth={} connectTimeoutMs={} socketTimeoutMs={}",
                hosts.length, auth, connectTimeoutMs, socketTimeoutMs);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(connectTimeoutMs)
                        .setConnectionRequestTimeout(connectTimeoutMs)
                        .setSocketTimeout(socketTimeoutMs));
        if (auth) {
            BasicCredentialsProvider credentials = new BasicCredentialsProvider();
            credentials.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
            builder.setHttpClientConfigCallback(hcb -> hcb.setDefaultCredentialsProvider(credentials));
        }
        return builder.build();
    }

    /**
     * The client gets its own copy of the application mapper; the Elasticsearch
     * mapper reconfigures whatever instance it is given.
     */
    @Bean
    public ElasticsearchClient incidentIndexClient(RestClient incidentIndexRestClient, ObjectMapper objectMapper) {
        ElasticsearchTransport transport =
                new RestClientTransport(incidentIndexRestClient, new JacksonJsonpMapper(objectMapper.copy()));
        return new ElasticsearchClient(transport);
    }

    /**
     * Runs the independent retrieval passes (lexical, classification, category) side by side.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService retrievalExecutor(@Value("${hazardrisk.retrieve.threads:0}") int configuredThreads) {
        int threads = configuredThreads > 0
                ? configuredThreads
                : Math.max(4, Runtime.getRuntime().availableProcessors());
        log.info("event=retrieval_executor_config threads={}", threads);
        return Executors.newFixedThreadPool(threads);
    }

    static HttpHost[] parseHosts(String urls) {
        if (urls == null || urls.isBlank()) {
            throw new IllegalArgumentException("hazardrisk.elasticsearch.url must name at least one node");
        }
        List<HttpHost> hosts = new ArrayList<>();
        for (String part : urls.split(",")) {
            String url = part.trim();
            if (url.isEmpty()) {
                continue;
            }
            URI uri = URI.create(url.contains("://") ? url : "http://" + url);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid Elasticsearch node URL: " + url);
            }
            String scheme = uri.getScheme() == null ? "http" : uri.getScheme();
            int port = uri.getPort() > 0 ? uri.getPort() : 9200;
            hosts.add(new HttpHost(uri.getHost(), port, scheme));
        }
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("hazardrisk.elasticsearch.url must name at least one node");
        }
        return hosts.toArray(new HttpHost[0]);
    }
}
