package com.github.simbo1905.irf;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/// Injects an IOException at a chosen file operation and checks that every public
/// operation turns it into a failure result and a log line.
public class InputRecordingFileExceptionHandlingTest extends JulLoggingConfig {

  /// seek, write, sync
  private static final int OPERATIONS_PER_BYTE = 3;

  private Path tempFile;
  private CapturingHandler handler;
  private Logger recordingLogger;

  @Before
  public void createFile() throws Exception {
    tempFile = Files.createTempFile("input-recording-faults", ".p2m2");
    handler = new CapturingHandler();
    recordingLogger = CapturingHandler.attach(getClass().getName() + ".recording", handler);
  }

  @After
  public void deleteFile() throws Exception {
    recordingLogger.removeHandler(handler);
    Files.deleteIfExists(tempFile);
  }

  /// Wraps every opened file in a delegate that throws at `throwAt`.
  static final class FailingRecordingFile extends InputRecordingFile {
    private final int throwAt;
    RandomAccessFile lastRandomAccessFile;
    DelegatingExceptionOperations lastOperations;

    FailingRecordingFile(Logger logger, int throwAt) {
      super(logger, "PCSX2", 1, 7, 0, true);
      this.throwAt = throwAt;
    }

    @Override
    FileOperations wrap(RandomAccessFile raf) {
      lastRandomAccessFile = raf;
      lastOperations = new DelegatingExceptionOperations(super.wrap(raf), throwAt);
      return lastOperations;
    }
  }

  private InputRecordingFile openWithHeader() {
    final InputRecordingFile recording =
        InputRecordingFile.builder().logger(recordingLogger).build();
    Assert.assertTrue(recording.openNew(tempFile, false));
    Assert.assertTrue(recording.writeHeader());
    return recording;
  }

  private static PadData pad() {
    final PadData padData = new PadData();
    for (int i = 0; i < InputRecordingFile.CONTROLLER_INPUT_BYTES; i++) {
      padData.updateControllerData(i, (byte) (0x40 + i));
    }
    return padData;
  }

  @Test
  public void testWriteFrameStopsAtFailingByteAndKeepsEarlierBytes() {
    final InputRecordingFile recording = openWithHeader();
    try {
      final int failingIndex = 5;
      // the write of byte 5 follows its seek
      final int throwAt = failingIndex * OPERATIONS_PER_BYTE + 2;
      final DelegatingExceptionOperations ops =
          new DelegatingExceptionOperations(recording.fileOperations, throwAt);
      recording.fileOperations = ops;

      Assert.assertFalse(recording.writeFrame(0, 0, pad()));
      Assert.assertTrue(ops.didThrow());
      assertThat(ops.getOperationCount(), is(throwAt));

      for (int i = 0; i < failingIndex; i++) {
        assertThat(recording.readKeyBuffer(0, 0, i), is(Optional.of((byte) (0x40 + i))));
      }
      Assert.assertFalse(recording.readKeyBuffer(0, 0, failingIndex).isPresent());
      Assert.assertTrue(recording.isFileOpen());
      Assert.assertTrue(handler.contains(Level.WARNING, "write failed"));
    } finally {
      recording.close();
    }
  }

  @Test
  public void testWriteHeaderFailsAtEveryOperation() {
    final InputRecordingFile recording = openWithHeader();
    try {
      final FileOperations direct = recording.fileOperations;
      final int totalOperations = discoverWriteHeaderOperations(recording, direct);

      for (int throwAt = 1; throwAt <= totalOperations; throwAt++) {
        final DelegatingExceptionOperations ops = new DelegatingExceptionOperations(direct, throwAt);
        recording.fileOperations = ops;
        Assert.assertFalse("throwAt=" + throwAt, recording.writeHeader());
        Assert.assertTrue(ops.didThrow());
        Assert.assertTrue(recording.isFileOpen());
      }

      recording.fileOperations = direct;
      Assert.assertTrue(recording.writeHeader());
      Assert.assertTrue(recording.verify());
    } finally {
      recording.close();
    }
  }

  private int discoverWriteHeaderOperations(InputRecordingFile recording, FileOperations direct) {
    final DelegatingExceptionOperations counting =
        new DelegatingExceptionOperations(direct, Integer.MAX_VALUE);
    recording.fileOperations = counting;
    Assert.assertTrue(recording.writeHeader());
    final int count = counting.getOperationCount();
    logger.log(Level.FINE, () -> String.format("writeHeader uses %d operations", count));
    return count;
  }

  @Test
  public void testCounterWritesReportFailureButKeepMemoryValues() {
    final InputRecordingFile recording = openWithHeader();
    try {
      final FileOperations direct = recording.fileOperations;

      recording.fileOperations = new DelegatingExceptionOperations(direct, 2);
      Assert.assertFalse(recording.incrementUndoCount());
      assertThat(recording.getUndoCount(), is(1L));

      recording.fileOperations = new DelegatingExceptionOperations(direct, 3);
      Assert.assertFalse(recording.setTotalFrames(12));
      assertThat(recording.getTotalFrames(), is(12));

      Assert.assertTrue(handler.contains(Level.WARNING, "undo count write failed"));
      Assert.assertTrue(handler.contains(Level.WARNING, "total frames write failed"));
    } finally {
      recording.close();
    }
  }

  @Test
  public void testBulkReadStopsOnReadError() {
    final InputRecordingFile recording = openWithHeader();
    try {
      for (int frame = 0; frame < 3; frame++) {
        Assert.assertTrue(recording.writeFrame(frame, 0, pad()));
      }
      // frame 0 is seek then read, frame 1 fails on its read
      recording.fileOperations = new DelegatingExceptionOperations(recording.fileOperations, 4);

      assertThat(recording.bulkReadPadData(0, 3, 0).keySet().size(), is(1));
      Assert.assertTrue(handler.contains(Level.WARNING, "bulk read failed at frame 1"));
    } finally {
      recording.close();
    }
  }

  @Test
  public void testFailedCloseStillReleasesInstance() throws IOException {
    final InputRecordingFile recording = openWithHeader();
    final FileOperations direct = recording.fileOperations;
    recording.fileOperations = new DelegatingExceptionOperations(direct, 1);

    Assert.assertFalse(recording.close());

    assertThat(recording.getState(), is(InputRecordingFile.State.CLOSED));
    Assert.assertFalse(recording.isFileOpen());
    assertThat(recording.getFilename(), is(""));
    Assert.assertTrue(handler.contains(Level.WARNING, "close failed"));
    direct.close();
  }

  @Test
  public void testReadErrorDuringVerifyReleasesHandle() {
    Assert.assertTrue(openWithHeader().close());

    final FailingRecordingFile recording = new FailingRecordingFile(recordingLogger, 1);
    Assert.assertFalse(recording.openExisting(tempFile));

    assertThat(recording.getState(), is(InputRecordingFile.State.CLOSED));
    Assert.assertTrue(recording.lastOperations.didThrow());
    Assert.assertFalse(recording.lastRandomAccessFile.getChannel().isOpen());
    Assert.assertTrue(handler.contains(Level.WARNING, "opening failed"));
  }

  @Test
  public void testTruncateErrorDuringOpenNewReleasesHandle() {
    final FailingRecordingFile recording = new FailingRecordingFile(recordingLogger, 1);
    Assert.assertFalse(recording.openNew(tempFile, true));

    assertThat(recording.getState(), is(InputRecordingFile.State.CLOSED));
    Assert.assertFalse(recording.isFromSavestate());
    Assert.assertFalse(recording.lastRandomAccessFile.getChannel().isOpen());
  }

  @Test
  public void testUnsupportedVersionReleasesHandle() {
    final InputRecordingFile writer = openWithHeader();
    writer.getHeader().setVersion(0);
    Assert.assertTrue(writer.writeHeader());
    Assert.assertTrue(writer.close());

    final FailingRecordingFile recording =
        new FailingRecordingFile(recordingLogger, Integer.MAX_VALUE);
    Assert.assertFalse(recording.openExisting(tempFile));

    Assert.assertFalse(recording.lastOperations.didThrow());
    Assert.assertFalse(recording.lastRandomAccessFile.getChannel().isOpen());
    Assert.assertTrue(handler.contains(Level.WARNING, "header is invalid"));
  }
}
