package com.github.simbo1905.irf;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// A frame-by-frame log of controller input for deterministic replay.
///
/// The file starts with an [InputRecordingHeader] followed by the total frame
/// watermark, the undo count and a one byte savestate-origin flag. After that
/// every frame takes [#INPUT_BYTES_PER_FRAME] bytes, one [#CONTROLLER_INPUT_BYTES]
/// block per controller port, so any (frame, port, byte) can be read or written
/// in place.
///
/// Operations report failure through their return value and a log line; they do
/// not throw for I/O errors. An instance is not thread safe and owns its file
/// handle exclusively.
public class InputRecordingFile {

  public static final int CONTROLLER_PORTS = 2;
  public static final int CONTROLLER_INPUT_BYTES = 18;
  public static final int INPUT_BYTES_PER_FRAME = CONTROLLER_INPUT_BYTES * CONTROLLER_PORTS;

  /// Header plus the total frames and undo count that follow it.
  public static final int HEADER_REGION_SIZE =
      InputRecordingHeader.HEADER_SIZE + Integer.BYTES + Integer.BYTES;

  static final long SEEKPOINT_TOTAL_FRAMES = InputRecordingHeader.HEADER_SIZE;
  static final long SEEKPOINT_UNDO_COUNT = SEEKPOINT_TOTAL_FRAMES + Integer.BYTES;
  static final long SEEKPOINT_SAVESTATE = SEEKPOINT_UNDO_COUNT + Integer.BYTES;
  static final int SAVESTATE_FLAG_SIZE = 1;

  /// Lifecycle of the file handle.
  /// <ul>
  ///   <li><b>CLOSED</b> - no handle; initial state and the state after close or a failed open</li>
  ///   <li><b>OPEN_NEW</b> - a new recording was created or truncated</li>
  ///   <li><b>OPEN_EXISTING</b> - an existing recording passed header verification</li>
  /// </ul>
  public enum State {
    CLOSED,
    OPEN_NEW,
    OPEN_EXISTING
  }

  private final Logger logger;
  private final String applicationName;
  private final int versionHi;
  private final int versionMid;
  private final int versionLo;
  private final boolean syncOnWrite;

  /*default*/ FileOperations fileOperations;

  @Getter private State state = State.CLOSED;

  private String filename = "";

  /// In-memory header; the copy on disk is only updated by [#writeHeader()].
  @Getter private final InputRecordingHeader header = new InputRecordingHeader();

  @Getter private int totalFrames;

  /// Unsigned 32 bit on disk.
  @Getter private long undoCount;

  @Getter private boolean fromSavestate;

  InputRecordingFile(
      Logger logger,
      String applicationName,
      int versionHi,
      int versionMid,
      int versionLo,
      boolean syncOnWrite) {
    this.logger = logger;
    this.applicationName = applicationName;
    this.versionHi = versionHi;
    this.versionMid = versionMid;
    this.versionLo = versionLo;
    this.syncOnWrite = syncOnWrite;
  }

  public static InputRecordingFileBuilder builder() {
    return new InputRecordingFileBuilder();
  }

  /// Creates or truncates `path` for a new recording. Counters are reset and the
  /// header is initialised, but nothing is written until [#writeHeader()].
  ///
  /// @return false if a file is already open or the file cannot be created
  public boolean openNew(Path path, boolean fromSavestate) {
    return open(path, true, fromSavestate);
  }

  /// Opens an existing recording without truncating it and verifies its header.
  /// If verification fails the handle is released and the in-memory header and
  /// counters keep their previous values.
  ///
  /// @return false if a file is already open, the file cannot be opened, or its header is invalid
  public boolean openExisting(Path path) {
    return open(path, false, false);
  }

  private boolean open(Path path, boolean newRecording, boolean fromSavestate) {
    Objects.requireNonNull(path, "path");
    if (isFileOpen()) {
      logger.log(
          Level.WARNING,
          () -> String.format("Input recording file %s is already open, cannot open %s", filename, path));
      return false;
    }
    // "rw" would create a missing file
    if (!newRecording && !Files.isRegularFile(path)) {
      logger.log(
          Level.WARNING,
          () -> String.format("Input recording file opening failed. Error - no such file %s", path));
      return false;
    }
    RandomAccessFile raf = null;
    boolean opened = false;
    try {
      raf = new RandomAccessFile(path.toFile(), "rw");
      final FileOperations ops = wrap(raf);
      if (newRecording) {
        ops.setLength(0);
        totalFrames = 0;
        undoCount = 0;
        header.init();
        setEmulatorVersion();
        this.fromSavestate = fromSavestate;
      } else if (!verifyRecordingFileHeader(ops)) {
        logger.log(Level.WARNING, "Input recording file header is invalid: " + path);
        return false;
      }
      fileOperations = ops;
      filename = path.toString();
      state = newRecording ? State.OPEN_NEW : State.OPEN_EXISTING;
      opened = true;
      logger.log(
          Level.FINE,
          () ->
              String.format(
                  "opened %s state=%s totalFrames=%d undoCount=%d fromSavestate=%b",
                  filename, state, totalFrames, undoCount, this.fromSavestate));
      return true;
    } catch (IOException e) {
      logger.log(
          Level.WARNING,
          "Input recording file opening failed. Error - " + e.getMessage(),
          e);
      return false;
    } finally {
      if (!opened && raf != null) {
        try {
          raf.close();
        } catch (IOException closeException) {
          logger.log(
              Level.WARNING,
              "Failed to close input recording file after failed open",
              closeException);
        }
      }
    }
  }

  /// Wraps the raw file. Tests override this to inject failures.
  FileOperations wrap(RandomAccessFile raf) {
    return new DirectRandomAccessFile(raf);
  }

  /// Releases the file handle and clears the filename.
  ///
  /// @return false if no file was open or the underlying close failed
  public boolean close() {
    if (fileOperations == null) {
      return false;
    }
    final FileOperations closing = fileOperations;
    final String closingName = filename;
    fileOperations = null;
    filename = "";
    state = State.CLOSED;
    try {
      closing.close();
      logger.log(Level.FINE, () -> String.format("closed %s", closingName));
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file close failed: " + closingName, e);
      return false;
    }
  }

  public boolean isFileOpen() {
    return fileOperations != null;
  }

  /// @return the path of the open file, or the empty string when closed
  public String getFilename() {
    return filename;
  }

  /// Sets the emulator version from the configured application name and version.
  public void setEmulatorVersion() {
    header.setEmulatorVersion(applicationName, versionHi, versionMid, versionLo);
  }

  /// Re-reads and checks the header of the open file, replacing the in-memory
  /// header and counters on success.
  ///
  /// @return false if closed, truncated, unreadable or not the supported version
  public boolean verify() {
    if (!isFileOpen()) {
      return false;
    }
    try {
      return verifyRecordingFileHeader(fileOperations);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file header read failed: " + filename, e);
      return false;
    }
  }

  /// Reads the preamble into scratch values and only adopts them if the whole
  /// preamble is present and the version is supported.
  private boolean verifyRecordingFileHeader(FileOperations ops) throws IOException {
    final InputRecordingHeader candidate = new InputRecordingHeader();
    final int frames;
    final long undo;
    final boolean savestate;
    try {
      ops.seek(0);
      candidate.readFrom(ops);
      frames = ops.readInt();
      undo = ops.readInt() & 0xFFFFFFFFL;
      savestate = ops.readByte() != 0;
    } catch (EOFException e) {
      logger.log(
          Level.WARNING,
          () ->
              String.format(
                  "Input recording file is truncated, the preamble needs %d bytes",
                  HEADER_REGION_SIZE + SAVESTATE_FLAG_SIZE));
      return false;
    }

    if (candidate.getVersion() != InputRecordingHeader.SUPPORTED_VERSION) {
      logger.log(
          Level.WARNING,
          () ->
              String.format(
                  "Input recording file is not a supported version - %d", candidate.getVersion()));
      return false;
    }

    header.copyFrom(candidate);
    totalFrames = frames;
    undoCount = undo;
    fromSavestate = savestate;
    return true;
  }

  /// Writes the header, total frames, undo count and savestate flag at offset zero.
  /// A failure part way leaves the preamble partly written.
  ///
  /// @return false if closed or any write fails
  public boolean writeHeader() {
    if (!isFileOpen()) {
      return false;
    }
    try {
      fileOperations.seek(0);
      header.writeTo(fileOperations);
      fileOperations.writeInt(totalFrames);
      fileOperations.writeInt((int) undoCount);
      fileOperations.write(fromSavestate ? 1 : 0);
      flush();
      logger.log(Level.FINE, () -> String.format("wrote header %s to %s", header, filename));
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file header write failed: " + filename, e);
      return false;
    }
  }

  /// Counts one undo or rerecord. The count always changes in memory but is only
  /// persisted when a file is open.
  ///
  /// @return whether the new count was written to the file
  public boolean incrementUndoCount() {
    undoCount++;
    if (!isFileOpen()) {
      return false;
    }
    try {
      fileOperations.seek(SEEKPOINT_UNDO_COUNT);
      fileOperations.writeInt((int) undoCount);
      flush();
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file undo count write failed: " + filename, e);
      return false;
    }
  }

  /// Raises the total frames watermark. Lower or equal values are ignored.
  ///
  /// @return whether a new watermark was written to the file
  public boolean setTotalFrames(int frame) {
    if (!isFileOpen() || totalFrames >= frame) {
      return false;
    }
    totalFrames = frame;
    try {
      fileOperations.seek(SEEKPOINT_TOTAL_FRAMES);
      fileOperations.writeInt(totalFrames);
      flush();
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file total frames write failed: " + filename, e);
      return false;
    }
  }

  /// Offset of the first byte of `frame`. The extra byte skips the savestate flag.
  public static long getRecordingBlockSeekPoint(long frame) {
    return HEADER_REGION_SIZE + SAVESTATE_FLAG_SIZE + frame * INPUT_BYTES_PER_FRAME;
  }

  /// Offset of byte `bufIndex` of `port` within `frame`.
  public static long getSeekPoint(long frame, int port, int bufIndex) {
    return getRecordingBlockSeekPoint(frame) + (long) CONTROLLER_INPUT_BYTES * port + bufIndex;
  }

  private boolean isValidCoordinate(int frame, int port, int bufIndex) {
    if (frame < 0 || port < 0 || port >= CONTROLLER_PORTS || bufIndex < 0 || bufIndex >= CONTROLLER_INPUT_BYTES) {
      logger.log(
          Level.WARNING,
          () ->
              String.format(
                  "Input recording coordinate out of range frame=%d port=%d index=%d",
                  frame, port, bufIndex));
      return false;
    }
    return true;
  }

  /// Reads one input byte.
  ///
  /// @return the byte, or empty if closed, out of range, or past the end of the file
  public Optional<Byte> readKeyBuffer(int frame, int port, int bufIndex) {
    if (!isFileOpen() || !isValidCoordinate(frame, port, bufIndex)) {
      return Optional.empty();
    }
    final long seek = getSeekPoint(frame, port, bufIndex);
    try {
      fileOperations.seek(seek);
      final byte result = fileOperations.readByte();
      logger.log(
          Level.FINEST,
          () -> String.format("<k fp:%d frame:%d port:%d idx:%d byte:0x%02X", seek, frame, port, bufIndex, result));
      return Optional.of(result);
    } catch (EOFException e) {
      logger.log(
          Level.FINE,
          () -> String.format("No recorded input at frame %d port %d index %d", frame, port, bufIndex));
      return Optional.empty();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file read failed: " + filename, e);
      return Optional.empty();
    }
  }

  /// Writes one input byte in place.
  ///
  /// @return false if closed, out of range, or the write fails
  public boolean writeKeyBuffer(int frame, int port, int bufIndex, byte buf) {
    if (!isFileOpen() || !isValidCoordinate(frame, port, bufIndex)) {
      return false;
    }
    final long seek = getSeekPoint(frame, port, bufIndex);
    try {
      fileOperations.seek(seek);
      fileOperations.write(buf);
      flush();
      logger.log(
          Level.FINEST,
          () -> String.format(">k fp:%d frame:%d port:%d idx:%d byte:0x%02X", seek, frame, port, bufIndex, buf));
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Input recording file write failed: " + filename, e);
      return false;
    }
  }

  /// Writes all bytes of `padData` for one port of one frame, lowest index first.
  /// Stops at the first failing byte; bytes already written are not rolled back.
  ///
  /// @return false if closed or any byte fails
  public boolean writeFrame(int frame, int port, PadData padData) {
    Objects.requireNonNull(padData, "padData");
    if (!isFileOpen()) {
      return false;
    }
    for (int i = 0; i < CONTROLLER_INPUT_BYTES; i++) {
      if (!writeKeyBuffer(frame, port, i, padData.pollControllerData(i))) {
        return false;
      }
    }
    return true;
  }

  /// Reads one port's input for each frame in `[frameStart, frameEnd)`. A negative
  /// start is treated as zero. Frames the file is too short to hold are left out of
  /// the result rather than reported, so a missing key means nothing was recorded.
  ///
  /// @return frames in ascending order; empty if closed or the port is out of range
  public NavigableMap<Integer, PadData> bulkReadPadData(int frameStart, int frameEnd, int port) {
    final NavigableMap<Integer, PadData> data = new TreeMap<>();
    if (!isFileOpen()) {
      return data;
    }
    if (port < 0 || port >= CONTROLLER_PORTS) {
      logger.log(Level.WARNING, () -> String.format("Input recording port out of range %d", port));
      return data;
    }

    final byte[] padBytes = new byte[CONTROLLER_INPUT_BYTES];
    for (int frame = Math.max(frameStart, 0); frame < frameEnd; frame++) {
      try {
        fileOperations.seek(getSeekPoint(frame, port, 0));
        fileOperations.readFully(padBytes);
      } catch (EOFException e) {
        // later frames lie further past the end
        final int lastFrame = frame;
        logger.log(Level.FINEST, () -> String.format("bulk read reached end of file at frame %d", lastFrame));
        break;
      } catch (IOException e) {
        logger.log(
            Level.WARNING,
            String.format("Input recording bulk read failed at frame %d of %s", frame, filename),
            e);
        break;
      }
      data.put(frame, PadData.of(padBytes));
    }
    return data;
  }

  private void flush() throws IOException {
    if (syncOnWrite) {
      fileOperations.sync();
    }
  }

  /// Command-line utility to dump the header, counters and recorded input of a file.
  ///
  /// @param args file name and an optional controller port (default 0)
  public static void main(String[] args) {
    if (args.length < 1) {
      System.err.println("no file passed");
      System.exit(1);
    }
    final int port = args.length > 1 ? Integer.parseInt(args[1]) : 0;
    final Logger out = Logger.getLogger(InputRecordingFile.class.getName());
    out.info("Reading from " + args[0]);
    if (!dumpFile(out, Level.INFO, Paths.get(args[0]), port)) {
      System.exit(2);
    }
  }

  static boolean dumpFile(Logger out, Level level, Path path, int port) {
    final InputRecordingFile recording = builder().logger(out).build();
    if (!recording.openExisting(path)) {
      return false;
    }
    try {
      final InputRecordingHeader h = recording.getHeader();
      out.log(
          level,
          () ->
              String.format(
                  "Version=%d, EmulatorVersion=%s, Author=%s, GameName=%s",
                  h.getVersion(), h.getEmulatorVersion(), h.getAuthor(), h.getGameName()));
      out.log(
          level,
          () ->
              String.format(
                  "TotalFrames=%d, UndoCount=%d, FromSavestate=%b",
                  recording.getTotalFrames(), recording.getUndoCount(), recording.isFromSavestate()));
      recording
          .bulkReadPadData(0, recording.getTotalFrames(), port)
          .forEach(
              (frame, padData) ->
                  out.log(level, () -> String.format("%d port=%d data=%s", frame, port, padData)));
      return true;
    } finally {
      recording.close();
    }
  }
}
