package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.config.FeederProperties;
import com.adsbrelay.feeder.decode.AdsbDecoder;
import com.adsbrelay.feeder.decode.CprParity;
import com.adsbrelay.feeder.model.GeoPosition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairs even and odd position frames into a global coordinate.
 *
 * <p>Rules applied on every stored frame:
 * <ul>
 *   <li>both slots must be filled before anything is decoded</li>
 *   <li>a pair further apart than the stale threshold drops the opposite slot and counts a stale
 *       event</li>
 *   <li>a decode failure keeps both slots so the next frame can complete the pair</li>
 * </ul>
 *
 * <p>Only called from the aggregator's ingest thread.
 */
@Component
public class PositionResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(PositionResolver.class);

  private final AdsbDecoder decoder;
  private final FeederProperties.Cpr cpr;
  private final GeoPosition reference;
  private final Counter resolvedCounter;
  private final Counter staleCounter;
  private final Counter failedCounter;

  public PositionResolver(AdsbDecoder decoder, FeederProperties properties, MeterRegistry meterRegistry) {
    this.decoder = decoder;
    this.cpr = properties.getCpr();
    FeederProperties.Receiver receiver = properties.getReceiver();
    this.reference = receiver.isConfigured()
        ? new GeoPosition(receiver.getLatitude(), receiver.getLongitude())
        : null;
    this.resolvedCounter = meterRegistry.counter("feeder.cpr.pairs", "outcome", "resolved");
    this.staleCounter = meterRegistry.counter("feeder.cpr.pairs", "outcome", "stale");
    this.failedCounter = meterRegistry.counter("feeder.cpr.pairs", "outcome", "failed");
  }

  /**
   * Stores a position frame and tries to resolve the aircraft position.
   *
   * <p>On success the record's position and distance fields are updated.
   *
   * @param record aircraft the frame belongs to
   * @param parity parity flag of the frame
   * @param frame raw hex frame
   * @param timestamp arrival time, epoch seconds
   * @return the new position, or empty when no position can be derived yet
   */
  Optional<GeoPosition> resolve(AircraftRecord record, CprParity parity, String frame, double timestamp) {
    CprPairState pair = record.cpr();
    pair.store(new ParitySlot(parity, frame, timestamp));
    if (!pair.isComplete()) {
      return Optional.empty();
    }

    ParitySlot even = pair.even();
    ParitySlot odd = pair.odd();
    double delta = Math.abs(even.timestamp() - odd.timestamp());
    if (delta > cpr.getStalePairSeconds()) {
      pair.discard(parity.opposite());
      pair.markStale();
      staleCounter.increment();
      if (pair.tryLog(timestamp, cpr.getFailureLogIntervalSeconds())) {
        LOGGER.debug("Stale CPR pair for {} (dt={}s, stale count={})",
            record.address(), delta, pair.staleCount());
      }
      return Optional.empty();
    }

    Optional<GeoPosition> position = decoder.globalPosition(
        even.frame(), odd.frame(), even.timestamp(), odd.timestamp(), reference);
    if (position.isEmpty()) {
      failedCounter.increment();
      if (pair.tryLog(timestamp, cpr.getFailureLogIntervalSeconds())) {
        LOGGER.debug("CPR pair for {} did not resolve to a position", record.address());
      }
      return Optional.empty();
    }

    pair.resetLogStreak();
    resolvedCounter.increment();
    GeoPosition resolved = position.get();
    record.setPosition(resolved, reference == null ? null : GreatCircle.distanceNm(reference, resolved));
    return position;
  }
}
