package com.dinoair.resilience.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.dinoair.resilience.scheduling.ManualScheduler;

import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

public class CloudWatchMetricPublisherTest {
  private final ManualScheduler scheduler = new ManualScheduler();
  private final CloudWatchClient client = mock(CloudWatchClient.class);

  @Test
  public void recordingNeverCallsTheClientUntilTheFlushRuns() {
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS", scheduler);

    pub.incrementCounter(MetricNames.CALLS_FAILED, "ollama", 3);
    pub.gauge(MetricNames.CIRCUIT_OPEN, "ollama", 1);
    verify(client, never()).putMetricData(any(PutMetricDataRequest.class));

    scheduler.advanceMillis(CloudWatchMetricPublisher.FLUSH_INTERVAL_MS);

    ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
    verify(client, times(1)).putMetricData(captor.capture());
    assertEquals("TestNS", captor.getValue().namespace());
    assertEquals(2, captor.getValue().metricData().size());
  }

  @Test
  public void countersAreSummedBetweenFlushes() {
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, null, scheduler);

    pub.incrementCounter(MetricNames.RATE_LIMIT_REJECTED, "chat", 2);
    pub.incrementCounter(MetricNames.RATE_LIMIT_REJECTED, "chat", 1);
    pub.flush();

    ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
    verify(client, times(1)).putMetricData(captor.capture());
    PutMetricDataRequest request = captor.getValue();
    assertEquals("DinoAirResilience", request.namespace());
    MetricDatum datum = request.metricData().get(0);
    assertEquals("RateLimitRejected", datum.metricName());
    assertEquals(3.0, datum.value(), 0.0001);
    assertEquals(StandardUnit.COUNT, datum.unit());
    assertEquals(CloudWatchMetricPublisher.DIMENSION, datum.dimensions().get(0).name());
    assertEquals("chat", datum.dimensions().get(0).value());
    assertEquals(scheduler.clock().instant(), datum.timestamp());
  }

  @Test
  public void emptyFlushSendsNothing() {
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS", scheduler);
    pub.incrementCounter(MetricNames.CALLS_SUCCEEDED, "comfyui", 1);
    pub.flush();
    pub.flush();

    verify(client, times(1)).putMetricData(any(PutMetricDataRequest.class));
  }

  @Test
  public void largeBuffersAreSplitIntoBatches() {
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS", scheduler);
    for (int i = 0; i < 45; i++)
      pub.gauge(MetricNames.DEPENDENCY_HEALTHY, "dependency-" + i, i);
    pub.flush();

    ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
    verify(client, times(3)).putMetricData(captor.capture());
    List<PutMetricDataRequest> requests = captor.getAllValues();
    int total = 0;
    for (PutMetricDataRequest r : requests) {
      assertTrue(r.metricData().size() <= CloudWatchMetricPublisher.MAX_BATCH);
      total += r.metricData().size();
    }
    assertEquals(45, total);
  }

  @Test
  public void closeStopsTheTimerAndFlushesTheRest() {
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS", scheduler);
    pub.incrementCounter(MetricNames.CALLS_REJECTED, "model-download", 1);

    pub.close();
    verify(client, times(1)).putMetricData(any(PutMetricDataRequest.class));
    assertEquals(0, scheduler.pendingTasks());
  }

  @Test
  public void clientFailuresAreNotPropagated() {
    when(client.putMetricData(any(PutMetricDataRequest.class)))
        .thenThrow(CloudWatchException.builder().message("throttled").build());
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS", scheduler);

    pub.gauge(MetricNames.DEPENDENCY_HEALTHY, "comfyui", 0);
    scheduler.advanceMillis(CloudWatchMetricPublisher.FLUSH_INTERVAL_MS);

    verify(client).putMetricData(any(PutMetricDataRequest.class));
  }
}
