package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.config.FeederProperties;
import com.adsbrelay.feeder.decode.AdsbDecoder;
import com.adsbrelay.feeder.model.AircraftSnapshot;
import com.adsbrelay.feeder.model.AircraftState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Keeps one {@link AircraftRecord} per ICAO address and merges decoded frames into it.
 *
 * <p>{@link #accept(String, double)} and {@link #ingest(String, String, double)} must be called
 * from a single thread (the frame source). After every ingest the aircraft's immutable state is
 * published to a concurrent map, which is what {@link #snapshot()} copies; readers never touch
 * the mutable records.
 */
@Component
public class AircraftStateAggregator {
  private static final int EXTENDED_SQUITTER = 17;
  private static final double ASSEMBLY_SWEEP_SECONDS = 10.0;

  private final AdsbDecoder decoder;
  private final PositionResolver positionResolver;
  private final double assemblyTimeoutSeconds;
  private final Map<String, AircraftRecord> records = new HashMap<>();
  private final ConcurrentHashMap<String, AircraftState> published = new ConcurrentHashMap<>();
  private final Counter acceptedCounter;
  private final Counter droppedCounter;
  private final Counter assemblyCompleteCounter;
  private final Counter assemblyIncompleteCounter;
  private double lastAssemblySweepAt = Double.NEGATIVE_INFINITY;

  public AircraftStateAggregator(
      AdsbDecoder decoder,
      PositionResolver positionResolver,
      FeederProperties properties,
      MeterRegistry meterRegistry) {
    this.decoder = decoder;
    this.positionResolver = positionResolver;
    this.assemblyTimeoutSeconds = properties.getAssembly().getTimeoutSeconds();
    this.acceptedCounter = meterRegistry.counter("feeder.frames", "outcome", "accepted");
    this.droppedCounter = meterRegistry.counter("feeder.frames", "outcome", "dropped");
    this.assemblyCompleteCounter = meterRegistry.counter("feeder.assembly", "outcome", "complete");
    this.assemblyIncompleteCounter = meterRegistry.counter("feeder.assembly", "outcome", "incomplete");
  }

  /**
   * Validates a raw frame and ingests it when it is an intact DF17 message.
   *
   * @param frame 28-character hex frame
   * @param timestamp arrival time, epoch seconds
   * @return {@code true} when the frame was handed to {@link #ingest(String, String, double)}
   */
  public boolean accept(String frame, double timestamp) {
    if (!decoder.isValid(frame) || decoder.downlinkFormat(frame) != EXTENDED_SQUITTER) {
      droppedCounter.increment();
      return false;
    }
    String address = decoder.address(frame);
    if (address == null || address.isBlank()) {
      droppedCounter.increment();
      return false;
    }
    acceptedCounter.increment();
    ingest(address, frame, timestamp);
    return true;
  }

  /**
   * Merges one decoded frame into the aircraft's record.
   *
   * <p>Frames of the wrong length, with non-hex characters or a non-zero CRC remainder are
   * dropped, as are frames with a type code outside identification, surface position, airborne
   * position and airborne velocity. Neither creates a record.
   *
   * @param address ICAO address, upper-case hex
   * @param frame 28-character hex DF17 frame
   * @param timestamp arrival time, epoch seconds
   */
  public void ingest(String address, String frame, double timestamp) {
    if (!decoder.isValid(frame)) {
      return;
    }
    int typeCode = decoder.typeCode(frame);
    if (!isTracked(typeCode)) {
      return;
    }

    AircraftRecord record = records.computeIfAbsent(address, key -> new AircraftRecord(key, timestamp));
    record.touch(timestamp);

    if (typeCode <= 4) {
      decoder.callsign(frame).ifPresent(record::setCallsign);
    } else if (typeCode <= 8) {
      decoder.parity(frame).ifPresent(parity -> positionResolver.resolve(record, parity, frame, timestamp));
      decoder.surfaceVelocity(frame).ifPresent(record::setVelocity);
    } else if (typeCode <= 18) {
      decoder.altitude(frame).ifPresent(record::setAltitude);
      decoder.parity(frame).ifPresent(parity -> positionResolver.resolve(record, parity, frame, timestamp));
    } else {
      decoder.airborneVelocity(frame).ifPresent(record::setVelocity);
    }

    trackAssembly(record, timestamp);
    published.put(address, record.toState());

    if (timestamp - lastAssemblySweepAt >= ASSEMBLY_SWEEP_SECONDS) {
      lastAssemblySweepAt = timestamp;
      for (AircraftRecord other : records.values()) {
        checkAssemblyTimeout(other, timestamp);
      }
    }
  }

  /**
   * Returns an immutable copy of every tracked aircraft.
   *
   * <p>Safe to call from any thread.
   */
  public AircraftSnapshot snapshot() {
    return new AircraftSnapshot(Collections.unmodifiableMap(new TreeMap<>(published)));
  }

  private static boolean isTracked(int typeCode) {
    return typeCode >= 1 && typeCode <= 19;
  }

  private void trackAssembly(AircraftRecord record, double timestamp) {
    if (record.assemblyTimeMs() == null && record.isFullyAssembled()) {
      record.setAssemblyTimeMs((timestamp - record.firstSeen()) * 1000.0);
      if (!record.isAssemblyIncomplete()) {
        assemblyCompleteCounter.increment();
      }
      return;
    }
    checkAssemblyTimeout(record, timestamp);
  }

  private void checkAssemblyTimeout(AircraftRecord record, double now) {
    if (record.assemblyTimeMs() != null || record.isAssemblyIncomplete()) {
      return;
    }
    if (now - record.firstSeen() > assemblyTimeoutSeconds) {
      record.markAssemblyIncomplete();
      assemblyIncompleteCounter.increment();
    }
  }
}
