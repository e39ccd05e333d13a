package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.decode.CprParity;

/**
 * Most recent position frame of one parity for one aircraft.
 *
 * @param parity CPR format of the frame
 * @param frame raw hex frame
 * @param timestamp arrival time, epoch seconds
 */
public record ParitySlot(CprParity parity, String frame, double timestamp) {}
