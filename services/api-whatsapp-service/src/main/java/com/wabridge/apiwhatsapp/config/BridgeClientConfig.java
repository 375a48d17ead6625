package com.wabridge.apiwhatsapp.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** HTTP clients of the bridge, one per timeout budget. */
@Configuration
public class BridgeClientConfig {

  @Bean
  @Qualifier("crmSettingsRestClient")
  public RestClient crmSettingsRestClient(RestClient.Builder builder, BridgeProperties properties) {
    return crm(builder, properties.crm(), properties.crm().timeout());
  }

  @Bean
  @Qualifier("crmRestClient")
  public RestClient crmRestClient(RestClient.Builder builder, BridgeProperties properties) {
    return crm(builder, properties.crm(), properties.crm().requestTimeout());
  }

  @Bean
  @Qualifier("webhookRestClient")
  public RestClient webhookRestClient(RestClient.Builder builder, BridgeProperties properties) {
    return builder.requestFactory(requestFactory(properties.webhooks().forwardTimeout())).build();
  }

  @Bean
  @Qualifier("mediaRestClient")
  public RestClient mediaRestClient(RestClient.Builder builder, BridgeProperties properties) {
    return builder.requestFactory(requestFactory(properties.media().timeout())).build();
  }

  private static RestClient crm(
      RestClient.Builder builder, BridgeProperties.Crm crm, Duration timeout) {
    RestClient.Builder configured =
        builder.baseUrl(crm.baseUrl()).requestFactory(requestFactory(timeout));
    if (crm.apiKey() != null && !crm.apiKey().isBlank()) {
      configured.defaultHeader("X-API-Key", crm.apiKey());
    }
    return configured.build();
  }

  static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeout);
    factory.setReadTimeout(timeout);
    return factory;
  }
}
