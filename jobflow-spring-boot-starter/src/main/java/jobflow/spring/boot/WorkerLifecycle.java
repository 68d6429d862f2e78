package jobflow.spring.boot;

import jobflow.worker.Worker;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link Worker} once the context is refreshed, after handlers are registered,
 * and stops it on shutdown. A stopped worker cannot be restarted.
 */
public class WorkerLifecycle implements SmartLifecycle {

  private final Worker<?> worker;

  public WorkerLifecycle(Worker<?> worker) {
    this.worker = worker;
  }

  @Override
  public void start() {
    worker.start();
  }

  @Override
  public void stop() {
    worker.stop();
  }

  @Override
  public boolean isRunning() {
    return worker.isRunning();
  }
}
