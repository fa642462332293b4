package com.flamingo.ai.pitchscoop.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Elasticsearch client, only created when the retrieval index is backed by Elasticsearch. */
@Configuration
@ConditionalOnProperty(name = "pitchscoop.retrieval.backend", havingValue = "elasticsearch")
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Bean(destroyMethod = "close")
  public RestClient elasticsearchRestClient() {
    return RestClient.builder(new HttpHost(host, port, scheme)).build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(
      RestClient elasticsearchRestClient, ObjectMapper objectMapper) {
    return new RestClientTransport(
        elasticsearchRestClient, new JacksonJsonpMapper(objectMapper.copy()));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
