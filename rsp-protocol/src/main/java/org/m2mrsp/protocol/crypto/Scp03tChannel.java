package org.m2mrsp.protocol.crypto;

import org.m2mrsp.protocol.model.SessionKeys;

/**
 * One side of a live SCP03t channel. Holds the session keys and a 4-byte big-endian command
 * counter that starts at 1 and is bound into every C-MAC, so a replayed or reordered APDU
 * fails MAC verification on the card side.
 * <p>
 * Thread-safe; wrap and unwrap each advance the counter atomically.
 */
public class Scp03tChannel {

  private final SessionKeys keys;
  private int counter;

  public Scp03tChannel(SessionKeys keys) {
    this.keys = keys;
  }

  /**
   * Host side: builds the next INSTALL APDU and advances the counter.
   */
  public synchronized byte[] wrapInstall(String isdpAid, byte[] data) {
    byte[] apdu = Scp03t.buildInstallApdu(keys, RspCrypto.int32(counter + 1), isdpAid, data);
    counter++;
    return apdu;
  }

  /**
   * Card side: opens the next INSTALL APDU. The counter only advances when the APDU verified.
   *
   * @throws org.m2mrsp.protocol.exception.MacVerificationFailedException on tampering or replay
   */
  public synchronized byte[] unwrapInstall(String isdpAid, byte[] apdu) {
    byte[] data = Scp03t.openInstallApdu(apdu, keys, RspCrypto.int32(counter + 1), isdpAid);
    counter++;
    return data;
  }

  public synchronized int getCounter() {
    return counter;
  }
}
