package com.github.simbo1905.irf;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for [InputRecordingFile] instances.
///
/// Example usage:
/// <pre>
/// InputRecordingFile recording = InputRecordingFile.builder()
///     .applicationName("PCSX2")
///     .applicationVersion(1, 7, 0)
///     .logger(Logger.getLogger("recording"))
///     .build();
/// recording.openNew(Paths.get("run.p2m2"), false);
/// </pre>
///
/// The application name and version default to the system property, then the
/// environment variable, named `com.github.simbo1905.irf.InputRecordingFile.APP_NAME`
/// and `com.github.simbo1905.irf.InputRecordingFile.APP_VERSION` (as `hi.mid.lo`).
public class InputRecordingFileBuilder {

  private static final Logger logger = Logger.getLogger(InputRecordingFileBuilder.class.getName());

  public static final String APP_NAME_PROPERTY = "APP_NAME";
  public static final String APP_VERSION_PROPERTY = "APP_VERSION";

  static final String DEFAULT_APP_NAME = "PCSX2";
  static final String DEFAULT_APP_VERSION = "1.7.0";

  private Logger recordingLogger;
  private String applicationName;
  private int[] applicationVersion;
  private boolean syncOnWrite = true;

  /// Sets the sink for diagnostics such as open failures and version mismatches.
  /// Defaults to the logger named after [InputRecordingFile].
  ///
  /// @param logger the logger to report through
  /// @return this builder for chaining
  public InputRecordingFileBuilder logger(Logger logger) {
    if (logger == null) {
      throw new IllegalArgumentException("logger cannot be null");
    }
    this.recordingLogger = logger;
    return this;
  }

  /// Sets the host application name used for the default emulator version.
  ///
  /// @param applicationName non-blank name
  /// @return this builder for chaining
  public InputRecordingFileBuilder applicationName(String applicationName) {
    if (applicationName == null || applicationName.isBlank()) {
      throw new IllegalArgumentException("applicationName cannot be blank");
    }
    this.applicationName = applicationName;
    return this;
  }

  /// Sets the three-part host application version used for the default emulator version.
  ///
  /// @return this builder for chaining
  public InputRecordingFileBuilder applicationVersion(int hi, int mid, int lo) {
    this.applicationVersion = checkVersion(hi, mid, lo);
    return this;
  }

  /// Whether each mutating write forces the file to the storage device.
  /// Default is true.
  ///
  /// @param syncOnWrite false to leave flushing to the operating system
  /// @return this builder for chaining
  public InputRecordingFileBuilder syncOnWrite(boolean syncOnWrite) {
    this.syncOnWrite = syncOnWrite;
    return this;
  }

  /// Creates a recording file in the closed state.
  public InputRecordingFile build() {
    final Logger resolvedLogger =
        recordingLogger != null
            ? recordingLogger
            : Logger.getLogger(InputRecordingFile.class.getName());
    final String resolvedName =
        applicationName != null
            ? applicationName
            : getPropertyOrDefault(APP_NAME_PROPERTY, DEFAULT_APP_NAME);
    final int[] resolvedVersion =
        applicationVersion != null
            ? applicationVersion
            : parseVersion(getPropertyOrDefault(APP_VERSION_PROPERTY, DEFAULT_APP_VERSION));

    logger.log(
        Level.FINE,
        () ->
            String.format(
                "Resolved configuration: logger=%s, application=%s-%d.%d.%d, syncOnWrite=%b",
                resolvedLogger.getName(),
                resolvedName,
                resolvedVersion[0],
                resolvedVersion[1],
                resolvedVersion[2],
                syncOnWrite));

    return new InputRecordingFile(
        resolvedLogger,
        resolvedName,
        resolvedVersion[0],
        resolvedVersion[1],
        resolvedVersion[2],
        syncOnWrite);
  }

  static String getPropertyOrDefault(String name, String defaultValue) {
    final String key = String.format("%s.%s", InputRecordingFile.class.getName(), name);
    String value = System.getenv(key) == null ? defaultValue : System.getenv(key);
    value = System.getProperty(key, value);
    return value;
  }

  static int[] parseVersion(String version) {
    final String[] parts = version.trim().split("\\.");
    if (parts.length != 3) {
      throw new IllegalArgumentException(
          "application version must be hi.mid.lo, got '" + version + "'");
    }
    try {
      return checkVersion(
          Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "application version must be hi.mid.lo, got '" + version + "'", e);
    }
  }

  private static int[] checkVersion(int hi, int mid, int lo) {
    if (hi < 0 || mid < 0 || lo < 0) {
      throw new IllegalArgumentException(
          String.format("version parts must be non-negative, got %d.%d.%d", hi, mid, lo));
    }
    return new int[] {hi, mid, lo};
  }
}
