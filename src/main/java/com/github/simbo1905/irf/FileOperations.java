package com.github.simbo1905.irf;

import java.io.IOException;

/// Positioned file I/O used by the recording file. Wrapping the final
/// `java.io.RandomAccessFile` in an interface lets tests inject failures at
/// any single operation.
interface FileOperations {

  /// Forces buffered modifications to the storage device. File metadata is not
  /// forced.
  void sync() throws IOException;

  void seek(long pos) throws IOException;

  void setLength(long newLength) throws IOException;

  /// Reads exactly `b.length` bytes.
  ///
  /// @throws java.io.EOFException if the file ends first
  void readFully(byte[] b) throws IOException;

  void write(int b) throws IOException;

  void write(byte[] b) throws IOException;

  byte readByte() throws IOException;

  short readShort() throws IOException;

  int readInt() throws IOException;

  void writeShort(int v) throws IOException;

  void writeInt(int v) throws IOException;

  void close() throws IOException;
}
