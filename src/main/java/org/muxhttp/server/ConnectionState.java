package org.muxhttp.server;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle and shared state of one accepted connection.
 * <p>
 * Holds the single write lock every worker must take to put a frame or a whole
 * response on the wire, and counts the workers still running so the connection is
 * only closed once they are all done.
 */
public final class ConnectionState {

    public enum Phase { OPEN, CLOSING, CLOSED }

    /** Monitor guarding phase and inFlight. */
    private final Object mon = new Object();

    // fair, so a stream with many frames cannot starve the others
    private final ReentrantLock writeLock = new ReentrantLock(true);

    private Phase phase = Phase.OPEN;
    private int inFlight;

    public ReentrantLock writeLock() {
        return writeLock;
    }

    public Phase phase() {
        synchronized (mon) {
            return phase;
        }
    }

    public boolean isOpen() {
        return phase() == Phase.OPEN;
    }

    /**
     * Registers a new worker. Refused once the connection has left OPEN.
     *
     * @return false if no new work may start
     */
    public boolean workerStarted() {
        synchronized (mon) {
            if (phase != Phase.OPEN) return false;
            inFlight++;
            return true;
        }
    }

    public void workerFinished() {
        synchronized (mon) {
            if (inFlight > 0) inFlight--;
            if (inFlight == 0) mon.notifyAll();
        }
    }

    public int inFlight() {
        synchronized (mon) {
            return inFlight;
        }
    }

    /** OPEN to CLOSING; no effect in later phases. */
    public void beginClosing() {
        synchronized (mon) {
            if (phase == Phase.OPEN) phase = Phase.CLOSING;
        }
    }

    /**
     * Blocks until every registered worker has finished.
     *
     * @return false if interrupted first (the interrupt flag is restored)
     */
    public boolean awaitIdle() {
        synchronized (mon) {
            while (inFlight > 0) {
                try {
                    mon.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public void markClosed() {
        synchronized (mon) {
            phase = Phase.CLOSED;
            mon.notifyAll();
        }
    }

    @Override
    public String toString() {
        synchronized (mon) {
            return "ConnectionState{phase=" + phase + ", inFlight=" + inFlight + '}';
        }
    }
}
