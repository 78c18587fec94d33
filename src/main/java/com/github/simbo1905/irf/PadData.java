package com.github.simbo1905.irf;

import java.util.Arrays;

/// The raw input bytes of one controller port for one frame. Button and analog
/// semantics belong to the emulator; the recording file only stores the bytes.
public final class PadData {

  private final byte[] bytes = new byte[InputRecordingFile.CONTROLLER_INPUT_BYTES];

  public PadData() {}

  /// Copies `bytes`, which must be exactly [InputRecordingFile#CONTROLLER_INPUT_BYTES] long.
  public static PadData of(byte[] bytes) {
    if (bytes == null || bytes.length != InputRecordingFile.CONTROLLER_INPUT_BYTES) {
      throw new IllegalArgumentException(
          String.format(
              "pad data must be %d bytes, got %s",
              InputRecordingFile.CONTROLLER_INPUT_BYTES,
              bytes == null ? "null" : Integer.toString(bytes.length)));
    }
    final PadData padData = new PadData();
    System.arraycopy(bytes, 0, padData.bytes, 0, bytes.length);
    return padData;
  }

  public byte pollControllerData(int index) {
    return bytes[index];
  }

  public void updateControllerData(int index, byte value) {
    bytes[index] = value;
  }

  public byte[] copyBytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return Arrays.equals(bytes, ((PadData) obj).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    sb.append("[ ");
    for (byte b : bytes) {
      sb.append(String.format("0x%02X ", b));
    }
    sb.append("]");
    return sb.toString();
  }
}
