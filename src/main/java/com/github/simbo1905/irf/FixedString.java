package com.github.simbo1905.irf;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// A zero-padded text field of a fixed number of bytes, as stored in the recording
/// header. Writes keep at most `capacity - 1` bytes so the last byte is always zero.
/// Reads stop at the first zero byte, else take the full capacity.
///
/// Text is encoded as UTF-8. Truncation works on bytes, so a multi-byte character
/// cut at the limit decodes as a replacement character.
final class FixedString {

  private final byte[] bytes;

  FixedString(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
    }
    this.bytes = new byte[capacity];
  }

  /// Copies the UTF-8 bytes of `text`, silently dropping whatever does not fit.
  void set(String text) {
    final byte[] source = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    final int count = Math.min(source.length, bytes.length - 1);
    Arrays.fill(bytes, (byte) 0);
    System.arraycopy(source, 0, bytes, 0, count);
  }

  void clear() {
    Arrays.fill(bytes, (byte) 0);
  }

  String get() {
    return new String(bytes, 0, length(), StandardCharsets.UTF_8);
  }

  /// Number of bytes before the first zero.
  int length() {
    int end = 0;
    while (end < bytes.length && bytes[end] != 0) {
      end++;
    }
    return end;
  }

  byte[] copyBytes() {
    return bytes.clone();
  }

  void writeTo(FileOperations file) throws IOException {
    file.write(bytes);
  }

  /// Reads exactly `capacity` bytes. Content is taken as stored, including a
  /// missing terminator, which is tolerated on read.
  void readFrom(FileOperations file) throws IOException {
    final byte[] read = new byte[bytes.length];
    file.readFully(read);
    System.arraycopy(read, 0, bytes, 0, bytes.length);
  }

  void copyFrom(FixedString other) {
    System.arraycopy(other.bytes, 0, bytes, 0, bytes.length);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return Arrays.equals(bytes, ((FixedString) obj).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return get();
  }
}
