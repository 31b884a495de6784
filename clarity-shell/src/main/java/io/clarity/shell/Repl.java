package io.clarity.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JLine front end for a {@link ReplSession}. */
public final class Repl implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Repl.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final ReplSession session;

  public Repl() throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    Path histPath = Paths.get(System.getProperty("user.home"), ".clarity", "history");
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      log.debug("History directory unavailable: {}", e.getMessage());
    }
    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.HISTORY_FILE, histPath)
            .history(new DefaultHistory())
            .build();
    this.session = new ReplSession(terminal.writer());
  }

  public void run() {
    terminal.writer().println("Clarity REPL. Type 'help' for help, 'exit' to leave.");
    terminal.flush();
    boolean running = true;
    while (running) {
      try {
        String prompt = session.isContinuation() ? "...> " : "clarity> ";
        String line = lineReader.readLine(prompt);
        running = line == null || session.accept(line);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.flush();
        running = false;
      }
    }
  }

  @Override
  public void close() throws IOException {
    terminal.close();
  }
}
