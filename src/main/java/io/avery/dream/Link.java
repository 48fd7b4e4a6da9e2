package io.avery.dream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The receiving end of linked crashes for one thread. A linked task that crashes {@link #deliver delivers} its crash
 * reason to the link of the thread that spawned it, which records the reason and interrupts that thread. The thread
 * notices at its next suspension point, by calling {@link #check()} or {@link #rethrow(InterruptedException)}.
 *
 * <p>The first unchecked crash wins; later crashes are suppressed onto it. Checking the link consumes the crash along
 * with the interrupt that announced it.
 */
final class Link {
    private static final Logger log = LoggerFactory.getLogger(Link.class);
    
    private static final ThreadLocal<Link> CURRENT = ThreadLocal.withInitial(() -> new Link(Thread.currentThread()));
    
    final Thread owner;
    volatile Throwable crash = null;
    
    private Link(Thread owner) {
        this.owner = owner;
    }
    
    static Link current() {
        return CURRENT.get();
    }
    
    void deliver(Throwable reason) {
        if (!owner.isAlive()) {
            log.warn("Dropping crash of linked dream, spawning thread {} has terminated", owner.getName(), reason);
            return;
        }
        log.debug("Delivering crash of linked dream to {}", owner.getName(), reason);
        // Setting the crash and interrupting happen together, so a check never consumes one without the other.
        synchronized (this) {
            Throwable existing = crash;
            if (existing == null) {
                crash = reason;
            } else if (existing != reason) {
                existing.addSuppressed(reason);
            }
            owner.interrupt();
        }
    }
    
    /**
     * Throws a {@code LinkedException} if a linked task spawned by the current thread has crashed since the last
     * check.
     *
     * @throws LinkedException if a linked crash is pending
     */
    static void check() {
        Link link = current();
        if (link.crash == null) {
            return;
        }
        Throwable reason;
        synchronized (link) {
            reason = link.crash;
            link.crash = null;
            Thread.interrupted();
        }
        if (reason != null) {
            throw new LinkedException("Linked dream crashed", reason);
        }
    }
    
    /**
     * Translates an interrupt received while waiting. If the interrupt announced a linked crash, throws a
     * {@code LinkedException}; otherwise rethrows the given exception.
     *
     * @param e the interrupt received while waiting
     * @return never returns normally; declared so callers can write {@code throw Link.rethrow(e)}
     * @throws InterruptedException if the interrupt did not come from a linked crash
     */
    static InterruptedException rethrow(InterruptedException e) throws InterruptedException {
        try {
            check();
        } catch (LinkedException linked) {
            linked.addSuppressed(e);
            throw linked;
        }
        throw e;
    }
}
