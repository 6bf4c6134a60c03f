package com.aiadvent.mcp.pages.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class RepositoryClientPropertiesTest {

  @Test
  void bindsNestedGroupsAndFallbacks() {
    Map<String, String> props = new HashMap<>();
    props.put("repository.client.owner", "acme");
    props.put("repository.client.name", "site");
    props.put("repository.client.branch", "gh-pages");
    props.put("repository.client.throttle.min-interval", "250ms");
    props.put("repository.client.throttle.max-per-minute", "30");
    props.put("repository.client.throttle.server-reserve", "10");
    props.put("repository.client.retry.max-attempts", "5");
    props.put("repository.client.retry.patience", "10m");
    props.put("repository.client.cache.ttl", "2m");
    props.put("repository.client.offline.failure-threshold", "3");
    props.put("repository.client.offline.watchdog-enabled", "false");
    props.put("repository.client.offline.fallbacks[index.html]", "<p>Site is offline</p>");
    props.put("repository.client.write.read-batch-size", "8");
    props.put("repository.client.deployment.timeout", "10m");

    RepositoryClientProperties properties = bind(props);

    assertThat(properties.getOwner()).isEqualTo("acme");
    assertThat(properties.getBranch()).isEqualTo("gh-pages");
    assertThat(properties.getThrottle().getMinInterval()).isEqualTo(Duration.ofMillis(250));
    assertThat(properties.getThrottle().getMaxPerMinute()).isEqualTo(30);
    assertThat(properties.getThrottle().getServerReserve()).isEqualTo(10);
    assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(5);
    assertThat(properties.getRetry().getPatience()).isEqualTo(Duration.ofMinutes(10));
    assertThat(properties.getCache().getTtl()).isEqualTo(Duration.ofMinutes(2));
    assertThat(properties.getOffline().getFailureThreshold()).isEqualTo(3);
    assertThat(properties.getOffline().isWatchdogEnabled()).isFalse();
    assertThat(properties.getOffline().getFallbacks()).containsEntry("index.html", "<p>Site is offline</p>");
    assertThat(properties.getWrite().getReadBatchSize()).isEqualTo(8);
    assertThat(properties.getDeployment().getTimeout()).isEqualTo(Duration.ofMinutes(10));
  }

  @Test
  void keepsDefaultsForUnsetGroups() {
    Map<String, String> props = new HashMap<>();
    props.put("repository.client.owner", "acme");
    props.put("repository.client.name", "site");

    RepositoryClientProperties properties = bind(props);

    assertThat(properties.getBranch()).isEqualTo("main");
    assertThat(properties.getBaseUrl()).isEqualTo("https://api.github.com");
    assertThat(properties.getThrottle().getMaxPerHour()).isEqualTo(1000);
    assertThat(properties.getThrottle().getServerReserve()).isZero();
    assertThat(properties.getRetry().getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
    assertThat(properties.getCache().getCapacity()).isEqualTo(50);
    assertThat(properties.getOffline().getProbeInterval()).isEqualTo(Duration.ofSeconds(60));
    assertThat(properties.getOffline().isWatchdogEnabled()).isTrue();
    assertThat(properties.getWrite().getConflictAttempts()).isEqualTo(3);
    assertThat(properties.getDeployment().getPollInterval()).isEqualTo(Duration.ofSeconds(10));
  }

  private RepositoryClientProperties bind(Map<String, String> props) {
    Binder binder = new Binder(new MapConfigurationPropertySource(props));
    return binder.bind("repository.client", Bindable.of(RepositoryClientProperties.class)).get();
  }
}
