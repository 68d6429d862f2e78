package jobflow.util;

/**
 * Blocking pause used by backoff loops. Tests substitute a recording sleeper
 * so retry schedules run without wall-clock delays.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps with {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
