package com.execrisk.service.events;

import com.execrisk.engine.scheduler.ExecutionReport;
import com.execrisk.engine.scheduler.ExecutionStatusListener;
import com.execrisk.infra.kafka.contract.payload.ParentOrderCompletedV1;
import com.execrisk.infra.kafka.producer.ExecutionEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaExecutionStatusForwarder implements ExecutionStatusListener {
  private static final Logger log = LoggerFactory.getLogger(KafkaExecutionStatusForwarder.class);

  private final ExecutionEventProducer producer;

  public KafkaExecutionStatusForwarder(ExecutionEventProducer producer) {
    this.producer = producer;
  }

  @Override
  public void onParentCompleted(ExecutionReport report) {
    producer
        .publishParentOrderCompleted(toPayload(report))
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                log.warn(
                    "Parent completion publish failed orderId={} status={} error={}",
                    report.parentId(),
                    report.status(),
                    error.getMessage());
              }
            });
  }

  static ParentOrderCompletedV1 toPayload(ExecutionReport report) {
    return new ParentOrderCompletedV1(
        report.parentId().toString(),
        report.instrument(),
        report.side().name(),
        report.algorithm().name(),
        report.status().name(),
        report.targetQty(),
        report.scheduledQty(),
        report.filledQty(),
        report.avgFillPrice(),
        report.arrivalMid(),
        report.slippageBps().orElse(null),
        report.slicesEmitted(),
        report.reason(),
        report.updatedAt());
  }
}
