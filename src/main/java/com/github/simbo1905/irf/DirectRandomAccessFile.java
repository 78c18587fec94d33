package com.github.simbo1905.irf;

import java.io.IOException;
import java.io.RandomAccessFile;

/*
 * easier to mock final native class by wrapping it in an interface
 */
record DirectRandomAccessFile(RandomAccessFile randomAccessFile) implements FileOperations {

  @Override
  public void sync() throws IOException {
    randomAccessFile.getChannel().force(false);
  }

  @Override
  public void seek(long pos) throws IOException {
    randomAccessFile.seek(pos);
  }

  @Override
  public void setLength(long newLength) throws IOException {
    randomAccessFile.setLength(newLength);
  }

  @Override
  public void readFully(byte[] b) throws IOException {
    randomAccessFile.readFully(b);
  }

  @Override
  public void write(int b) throws IOException {
    randomAccessFile.write(b);
  }

  @Override
  public void write(byte[] b) throws IOException {
    randomAccessFile.write(b);
  }

  @Override
  public byte readByte() throws IOException {
    return randomAccessFile.readByte();
  }

  @Override
  public short readShort() throws IOException {
    return randomAccessFile.readShort();
  }

  @Override
  public int readInt() throws IOException {
    return randomAccessFile.readInt();
  }

  @Override
  public void writeShort(int v) throws IOException {
    randomAccessFile.writeShort(v);
  }

  @Override
  public void writeInt(int v) throws IOException {
    randomAccessFile.writeInt(v);
  }

  @Override
  public void close() throws IOException {
    randomAccessFile.close();
  }
}
