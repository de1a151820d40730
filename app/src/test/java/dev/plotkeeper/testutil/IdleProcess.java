package dev.plotkeeper.testutil;

import java.io.InputStream;
import java.io.OutputStream;

/** A process that is never started; only its identity matters to the code under test. */
public final class IdleProcess extends Process {
    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() {
        return 0;
    }

    @Override
    public int exitValue() {
        return 0;
    }

    @Override
    public void destroy() {}

    @Override
    public long pid() {
        return 4242;
    }
}
