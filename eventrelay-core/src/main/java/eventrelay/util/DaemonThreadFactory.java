package eventrelay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>N}, numbered from 1.
 *
 * <p>Uncaught exceptions are logged at SEVERE against the thread name instead of going to
 * {@code System.err}, so a failing poller, worker or delivery task shows up in the same log
 * as everything else.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String namePrefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String namePrefix) {
    this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, namePrefix + sequence.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
    return worker;
  }
}
