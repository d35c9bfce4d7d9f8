package com.shopstream.sink;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.config.ElasticsearchConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Upserts documents into one Elasticsearch index with the bulk API.  Every document is an
 * {@code index} operation with an explicit {@code _id}, so a re-delivered document
 * overwrites the earlier version instead of adding a second one.
 */
@Slf4j
public class ElasticsearchUpsertSink implements UpsertSink {

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final String index;

    public ElasticsearchUpsertSink(ElasticsearchConfig config, ObjectMapper objectMapper) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
        this.client = new ElasticsearchClient(transport);
        this.index = config.getIndex();
        log.info("Elasticsearch sink targeting index={} hosts={}", index, config.getHosts());
    }

    /**
     * Wraps an existing client; the caller owns its transport.
     */
    public ElasticsearchUpsertSink(ElasticsearchClient client, String index) {
        this.client = client;
        this.restClient = null;
        this.index = index;
    }

    @Override
    public List<UpsertResult> upsert(List<? extends SinkDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        BulkRequest.Builder bulk = new BulkRequest.Builder();
        for (SinkDocument document : documents) {
            bulk.operations(op -> op.index(idx -> idx
                    .index(index)
                    .id(document.getDocumentId())
                    .document(document)));
        }

        BulkResponse response;
        try {
            response = client.bulk(bulk.build());
        } catch (IOException | ElasticsearchException e) {
            throw new SinkWriteFailedException(
                    "Bulk upsert of " + documents.size() + " documents to index " + index + " failed", e);
        }

        List<BulkResponseItem> items = response.items();
        List<UpsertResult> results = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            String id = documents.get(i).getDocumentId();
            if (i >= items.size()) {
                results.add(UpsertResult.failed(id, "missing bulk response item"));
                continue;
            }
            BulkResponseItem item = items.get(i);
            if (item.error() != null) {
                results.add(UpsertResult.failed(id, item.error().type() + ": " + item.error().reason()));
            } else {
                results.add(UpsertResult.ok(id));
            }
        }
        if (response.errors()) {
            log.warn("Bulk upsert to index={} had per-document failures", index);
        } else {
            log.debug("Bulk upserted {} documents to index={}", documents.size(), index);
        }
        return results;
    }

    @Override
    public void close() {
        if (restClient != null) {
            try {
                restClient.close();
            } catch (IOException e) {
                log.warn("Error closing Elasticsearch REST client", e);
            }
        }
    }
}
