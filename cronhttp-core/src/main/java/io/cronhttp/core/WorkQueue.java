package io.cronhttp.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of jobs shared by job registration (producer), the scheduler loop (consumer) and
 * the runners (producers of re-scheduled jobs).
 *
 * <p>The queue remembers which job object is in rotation for each id, i.e. queued, waiting for its
 * run time or executing. A second {@link #submit} of a live id is refused, so a job can never fire
 * twice concurrently. Runners hand a job back with {@link #requeue} and take it out of rotation with
 * {@link #retire}; both are ignored for an object that is no longer the one in rotation, such as a
 * run still pending from before {@link #clear}.
 */
public class WorkQueue {
    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    private static final Entry STOP = new Entry(null);

    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
    private final Map<Long, Job> inRotation = new ConcurrentHashMap<>();

    private record Entry(Job job) {
    }

    /**
     * Puts a job into rotation.
     *
     * @return false if the job is done or already in rotation
     */
    public boolean submit(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.getId(), "job.id must not be null");
        if (job.isDone()) {
            log.debug("Refusing to enqueue finished job {}", job.describe());
            return false;
        }
        if (inRotation.putIfAbsent(job.getId(), job) != null) {
            log.warn("Job {} is already scheduled; ignoring duplicate submit", job.describe());
            return false;
        }
        queue.add(new Entry(job));
        return true;
    }

    /**
     * Hands a job that is already in rotation back to the scheduler loop.
     */
    public void requeue(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.isDone()) {
            retire(job);
            return;
        }
        if (!isCurrent(job)) {
            log.warn("Requeue of job {} which is not in rotation; ignoring", job.describe());
            return;
        }
        queue.add(new Entry(job));
    }

    /**
     * Removes a job from rotation; a later {@link #submit} of the same id is accepted again.
     */
    public void retire(Job job) {
        inRotation.remove(job.getId(), job);
    }

    /**
     * Makes the consumer's next {@link #take} return null once the jobs queued before it are drained.
     */
    public void stop() {
        queue.add(STOP);
    }

    /**
     * Blocks until a job is available.
     *
     * @return the next job, or null when the stop signal is reached
     */
    public Job take() throws InterruptedException {
        Entry e = queue.take();
        return e == STOP ? null : e.job();
    }

    /**
     * True if this very object is the one in rotation for its id.
     */
    public boolean isCurrent(Job job) {
        return job.getId() != null && inRotation.get(job.getId()) == job;
    }

    public boolean isInRotation(long jobId) {
        return inRotation.containsKey(jobId);
    }

    /**
     * Number of entries waiting to be taken, including a pending stop signal.
     */
    public int size() {
        return queue.size();
    }

    /**
     * Drops everything, including the rotation bookkeeping.
     */
    public void clear() {
        queue.clear();
        inRotation.clear();
    }
}
