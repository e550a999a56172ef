package com.yourapp.tracker.habit_tracker.terminal;

import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;

public class JLineMenuTerminal implements MenuTerminal {
    private final Terminal terminal;
    private final KeyDecoder decoder;
    private final CharSource source;

    public JLineMenuTerminal(Terminal terminal, KeyDecoder decoder) {
        this.terminal = terminal;
        this.decoder = decoder;
        this.source = new ReaderCharSource(terminal.reader());
    }

    @Override
    public KeyEvent readKey() throws IOException {
        terminal.flush();
        try (RawModeScope ignored = RawModeScope.enter(terminal)) {
            return decoder.decode(source);
        }
    }

    @Override
    public void clear() {
        terminal.puts(InfoCmp.Capability.clear_screen);
    }

    @Override
    public void println(String line) {
        terminal.writer().println(line);
    }

    @Override
    public void flush() {
        terminal.flush();
    }

    private static final class ReaderCharSource implements CharSource {
        private final NonBlockingReader reader;

        ReaderCharSource(NonBlockingReader reader) {
            this.reader = reader;
        }

        @Override
        public int read() throws IOException {
            return reader.read();
        }

        @Override
        public int read(long timeoutMillis) throws IOException {
            // NonBlockingReader reports expiry as -2 and end of stream as -1, same as CharSource
            return reader.read(timeoutMillis);
        }
    }
}
