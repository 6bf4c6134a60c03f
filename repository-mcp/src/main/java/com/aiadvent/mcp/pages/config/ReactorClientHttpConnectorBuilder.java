package com.aiadvent.mcp.pages.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

/** Netty connector for the published site client; follows redirects. */
public class ReactorClientHttpConnectorBuilder {

  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(30);
  private boolean followRedirects = true;

  public ReactorClientHttpConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder readTimeout(Duration readTimeout) {
    if (readTimeout != null) {
      this.readTimeout = readTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder followRedirects(boolean followRedirects) {
    this.followRedirects = followRedirects;
    return this;
  }

  public ClientHttpConnector build() {
    HttpClient client =
        HttpClient.create()
            .responseTimeout(readTimeout)
            .proxyWithSystemProperties()
            .followRedirect(followRedirects)
            .compress(true)
            .keepAlive(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
