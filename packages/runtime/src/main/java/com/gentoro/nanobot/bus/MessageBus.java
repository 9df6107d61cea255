package com.gentoro.nanobot.bus;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decouples channel adapters from the agent loop through two independent, unbounded FIFO queues.
 *
 * <ul>
 *   <li>Inbound: adapters (and the subagent manager) publish, the agent loop consumes.
 *   <li>Outbound: the agent loop and tools publish, {@link #dispatchOutbound()} delivers each
 *       message to the callback registered for its channel.
 * </ul>
 *
 * <p>Both queues accept any number of concurrent producers and consumers. No ordering holds
 * between the two queues.
 */
public class MessageBus {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(MessageBus.class);

  private static final long DISPATCH_POLL_MS = 1000;

  private final BlockingQueue<InboundMessage> inbound = new LinkedBlockingQueue<>();
  private final BlockingQueue<OutboundMessage> outbound = new LinkedBlockingQueue<>();
  private final Map<String, OutboundCallback> subscribers = new ConcurrentHashMap<>();
  private final AtomicBoolean dispatching = new AtomicBoolean(false);
  private final AtomicLong dropped = new AtomicLong();

  public void publishInbound(InboundMessage message) {
    inbound.add(Objects.requireNonNull(message, "message"));
  }

  /** Block until an inbound message is available. */
  public InboundMessage consumeInbound() throws InterruptedException {
    return inbound.take();
  }

  /**
   * Wait at most {@code timeout} for an inbound message.
   *
   * @return the next message, or {@code null} when the wait timed out
   */
  public InboundMessage consumeInbound(long timeout, TimeUnit unit) throws InterruptedException {
    return inbound.poll(timeout, unit);
  }

  public void publishOutbound(OutboundMessage message) {
    outbound.add(Objects.requireNonNull(message, "message"));
  }

  /** Wait at most {@code timeout} for an outbound message; {@code null} on timeout. */
  public OutboundMessage consumeOutbound(long timeout, TimeUnit unit) throws InterruptedException {
    return outbound.poll(timeout, unit);
  }

  /** Register the delivery callback for {@code channel}. The last registration wins. */
  public void subscribeOutbound(String channel, OutboundCallback callback) {
    OutboundCallback previous =
        subscribers.put(Objects.requireNonNull(channel, "channel"), callback);
    if (previous != null) {
      log.debug("Replaced outbound subscriber for channel '{}'", channel);
    }
  }

  /**
   * Standing loop delivering outbound messages until {@link #stop()} is called or the thread is
   * interrupted. Messages for channels without a subscriber are dropped and counted; a failing
   * callback is logged and does not stop the loop.
   */
  public void dispatchOutbound() {
    dispatching.set(true);
    log.debug("Outbound dispatcher started");
    try {
      while (dispatching.get()) {
        OutboundMessage message = outbound.poll(DISPATCH_POLL_MS, TimeUnit.MILLISECONDS);
        if (message != null) {
          deliver(message);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      log.debug("Outbound dispatcher stopped");
    }
  }

  /** Deliver a single outbound message to its channel's subscriber. */
  public boolean deliver(OutboundMessage message) {
    OutboundCallback callback = subscribers.get(message.channel());
    if (callback == null) {
      dropped.incrementAndGet();
      log.warn(
          "No subscriber for channel '{}', dropping outbound message to chat {}",
          message.channel(),
          message.chatId());
      return false;
    }
    try {
      callback.deliver(message);
      return true;
    } catch (Exception e) {
      log.error(
          "Error delivering outbound message to {}:{}", message.channel(), message.chatId(), e);
      return false;
    }
  }

  public void stop() {
    dispatching.set(false);
  }

  public int inboundSize() {
    return inbound.size();
  }

  public int outboundSize() {
    return outbound.size();
  }

  /** Outbound messages dropped because their channel had no subscriber. */
  public long droppedCount() {
    return dropped.get();
  }
}
