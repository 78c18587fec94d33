package com.github.simbo1905.irf;

import java.io.IOException;
import lombok.Getter;

/// The fixed-size metadata block at the start of every input recording file.
///
/// Layout, big-endian:
/// <pre>
///   version           2 bytes, unsigned
///   emulator version 50 bytes, zero padded
///   author          255 bytes, zero padded
///   game name       255 bytes, zero padded
/// </pre>
public final class InputRecordingHeader {

  /// The only file format version this implementation reads or writes.
  public static final int SUPPORTED_VERSION = 1;

  static final int EMULATOR_VERSION_CAPACITY = 50;
  static final int AUTHOR_CAPACITY = 255;
  static final int GAME_NAME_CAPACITY = 255;

  /// Size in bytes of the header as persisted.
  public static final int HEADER_SIZE =
      Short.BYTES + EMULATOR_VERSION_CAPACITY + AUTHOR_CAPACITY + GAME_NAME_CAPACITY;

  @Getter private int version = SUPPORTED_VERSION;

  private final FixedString emulatorVersion = new FixedString(EMULATOR_VERSION_CAPACITY);
  private final FixedString author = new FixedString(AUTHOR_CAPACITY);
  private final FixedString gameName = new FixedString(GAME_NAME_CAPACITY);

  /// Clears author and game name for a brand-new recording. The version and
  /// emulator version are left as they are.
  public void init() {
    author.clear();
    gameName.clear();
  }

  /// Sets the format version written by the next header write. Only
  /// [#SUPPORTED_VERSION] can be opened again.
  public void setVersion(int version) {
    if (version < 0 || version > 0xFFFF) {
      throw new IllegalArgumentException("version must fit in 16 unsigned bits, got " + version);
    }
    this.version = version;
  }

  public String getEmulatorVersion() {
    return emulatorVersion.get();
  }

  /// Stores at most 49 bytes of `version`.
  public void setEmulatorVersion(String version) {
    emulatorVersion.set(version);
  }

  /// Stores `"<appName>-<hi>.<mid>.<lo>"` as the emulator version.
  public void setEmulatorVersion(String appName, int hi, int mid, int lo) {
    setEmulatorVersion(String.format("%s-%d.%d.%d", appName, hi, mid, lo));
  }

  public String getAuthor() {
    return author.get();
  }

  /// Stores at most 254 bytes of `author`.
  public void setAuthor(String author) {
    this.author.set(author);
  }

  public String getGameName() {
    return gameName.get();
  }

  /// Stores at most 254 bytes of `gameName`.
  public void setGameName(String gameName) {
    this.gameName.set(gameName);
  }

  byte[] authorBytes() {
    return author.copyBytes();
  }

  void writeTo(FileOperations file) throws IOException {
    file.writeShort(version);
    emulatorVersion.writeTo(file);
    author.writeTo(file);
    gameName.writeTo(file);
  }

  void readFrom(FileOperations file) throws IOException {
    version = file.readShort() & 0xFFFF;
    emulatorVersion.readFrom(file);
    author.readFrom(file);
    gameName.readFrom(file);
  }

  void copyFrom(InputRecordingHeader other) {
    version = other.version;
    emulatorVersion.copyFrom(other.emulatorVersion);
    author.copyFrom(other.author);
    gameName.copyFrom(other.gameName);
  }

  @Override
  public String toString() {
    return String.format(
        "InputRecordingHeader[version=%d, emulatorVersion=%s, author=%s, gameName=%s]",
        version, emulatorVersion, author, gameName);
  }
}
