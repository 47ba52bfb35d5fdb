package com.jarvis.core.transport;

import com.jarvis.core.concurrent.DaemonThreadFactory;
import com.jarvis.core.events.EnvelopeCodec;
import com.jarvis.core.events.EventEnvelope;
import com.jarvis.core.events.EventHandler;
import com.jarvis.core.events.MalformedEnvelopeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Durable transport over Redis Streams with consumer groups.
 * <p>
 * Each topic maps to stream {@code <prefix><topic>}. A subscription runs one read
 * loop thread that first re-reads this consumer's pending (delivered but unacked)
 * entries, then blocks for new ones. An entry is acknowledged only after its handler
 * returned normally, so a crash before that point means redelivery on restart.
 * Entries that cannot be decoded are acknowledged and dropped.
 */
public class RedisStreamTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamTransport.class);

    static final String FIELD_DATA = "data";
    static final String FIELD_PRODUCER = "producer";
    static final String FIELD_TIMESTAMP = "timestamp";

    /**
     * @param keyPrefix    stream key prefix, e.g. {@code events:}
     * @param group        consumer group shared by instances of one service
     * @param consumerId   this instance's name within the group
     * @param batchSize    entries per read
     * @param blockTimeout how long one read waits for new entries
     * @param backoffBase  first retry delay after a read error
     * @param backoffMax   retry delay cap
     */
    public record Settings(String keyPrefix, String group, String consumerId, int batchSize,
                           Duration blockTimeout, Duration backoffBase, Duration backoffMax) {
    }

    private final StringRedisTemplate redis;
    private final EnvelopeCodec codec;
    private final Settings settings;
    private final ExponentialBackoff backoff;
    private final ConcurrentHashMap<String, ReadLoop> loops = new ConcurrentHashMap<>();
    private volatile ExecutorService executor;

    public RedisStreamTransport(StringRedisTemplate redis, EnvelopeCodec codec, Settings settings) {
        this.redis = redis;
        this.codec = codec;
        this.settings = settings;
        this.backoff = new ExponentialBackoff(settings.backoffBase(), settings.backoffMax());
    }

    @Override
    public String name() {
        return "stream";
    }

    public String streamKey(String topic) {
        return settings.keyPrefix() + topic;
    }

    @Override
    public synchronized void connect() {
        if (executor != null) {
            return;
        }
        try {
            redis.execute((RedisCallback<String>) connection -> connection.ping());
        } catch (DataAccessException e) {
            throw new TransportException("Cannot connect to Redis: " + e.getMessage(), e);
        }
        executor = Executors.newCachedThreadPool(new DaemonThreadFactory("jarvis-stream-"));
        log.info("Redis stream transport connected (group={}, consumer={})",
                settings.group(), settings.consumerId());
    }

    @Override
    public synchronized void disconnect() {
        ExecutorService current = executor;
        executor = null;
        loops.values().forEach(ReadLoop::stop);
        loops.clear();
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            long waitMs = settings.blockTimeout().toMillis() + 5_000;
            if (!current.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Stream read loops did not stop within {}ms; interrupting", waitMs);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        log.info("Redis stream transport disconnected");
    }

    @Override
    public boolean isConnected() {
        return executor != null;
    }

    @Override
    public void publish(EventEnvelope envelope) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_DATA, codec.encode(envelope));
        fields.put(FIELD_PRODUCER, envelope.producer());
        fields.put(FIELD_TIMESTAMP, String.valueOf(envelope.timestamp()));
        try {
            RecordId id = streams().add(StreamRecords.newRecord().in(streamKey(envelope.topic())).ofMap(fields));
            log.debug("Appended {} to {} as {}", envelope.id(), streamKey(envelope.topic()), id);
        } catch (DataAccessException e) {
            throw new TransportException("XADD to " + streamKey(envelope.topic()) + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        ExecutorService current = executor;
        if (current == null) {
            throw new TransportException("Redis stream transport is not connected");
        }
        if (loops.containsKey(topic)) {
            return;
        }
        ensureGroup(streamKey(topic));
        ReadLoop loop = new ReadLoop(topic, handler);
        if (loops.putIfAbsent(topic, loop) == null) {
            current.execute(loop);
            log.info("Started stream read loop for {} ({})", topic, streamKey(topic));
        }
    }

    @Override
    public void unsubscribe(String topic) {
        ReadLoop loop = loops.remove(topic);
        if (loop != null) {
            loop.stop();
        }
    }

    /** Creates the consumer group (and the stream, if missing); an existing group is fine. */
    void ensureGroup(String key) {
        try {
            streams().createGroup(key, ReadOffset.from("0"), settings.group());
            log.info("Created consumer group {} on {}", settings.group(), key);
        } catch (DataAccessException e) {
            if (!isBusyGroup(e)) {
                throw new TransportException("Cannot create consumer group on " + key + ": " + e.getMessage(), e);
            }
        }
    }

    private static boolean isBusyGroup(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
                return true;
            }
        }
        return false;
    }

    private StreamOperations<String, String, String> streams() {
        return redis.opsForStream();
    }

    private final class ReadLoop implements Runnable {

        private final String topic;
        private final String key;
        private final EventHandler handler;
        private final CountDownLatch stopSignal = new CountDownLatch(1);

        ReadLoop(String topic, EventHandler handler) {
            this.topic = topic;
            this.key = streamKey(topic);
            this.handler = handler;
        }

        void stop() {
            stopSignal.countDown();
        }

        boolean stopped() {
            return stopSignal.getCount() == 0;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void run() {
            Consumer consumer = Consumer.from(settings.group(), settings.consumerId());
            // Pending entries first; null once the backlog is drained.
            String backlogOffset = "0";
            int failures = 0;
            while (!stopped()) {
                try {
                    List<MapRecord<String, String, String>> records;
                    if (backlogOffset != null) {
                        records = streams().read(consumer,
                                StreamReadOptions.empty().count(settings.batchSize()),
                                StreamOffset.create(key, ReadOffset.from(backlogOffset)));
                    } else {
                        records = streams().read(consumer,
                                StreamReadOptions.empty().count(settings.batchSize()).block(settings.blockTimeout()),
                                StreamOffset.create(key, ReadOffset.lastConsumed()));
                    }
                    failures = 0;
                    if (records == null || records.isEmpty()) {
                        if (backlogOffset != null) {
                            log.debug("Pending backlog for {} drained", topic);
                            backlogOffset = null;
                        }
                        continue;
                    }
                    for (MapRecord<String, String, String> record : records) {
                        process(record);
                    }
                    if (backlogOffset != null) {
                        backlogOffset = records.get(records.size() - 1).getId().getValue();
                    }
                } catch (RuntimeException e) {
                    failures++;
                    long delay = backoff.computeDelayMs(failures);
                    log.warn("Read from {} failed (attempt {}), retrying in {}ms: {}",
                            key, failures, delay, e.getMessage());
                    if (awaitStop(delay)) {
                        break;
                    }
                }
            }
            log.info("Stream read loop for {} stopped", topic);
        }

        private void process(MapRecord<String, String, String> record) {
            String json = record.getValue() == null ? null : record.getValue().get(FIELD_DATA);
            EventEnvelope envelope;
            try {
                if (json == null) {
                    throw new MalformedEnvelopeException("entry has no '" + FIELD_DATA + "' field");
                }
                envelope = codec.decode(json);
            } catch (MalformedEnvelopeException e) {
                log.warn("Dropping undecodable entry {} on {}: {}", record.getId(), key, e.getMessage());
                acknowledge(record);
                return;
            }
            try {
                handler.handle(envelope);
            } catch (Exception e) {
                log.warn("Handler for {} failed on entry {}; left pending for redelivery: {}",
                        topic, record.getId(), e.getMessage(), e);
                return;
            }
            acknowledge(record);
        }

        private void acknowledge(MapRecord<String, String, String> record) {
            streams().acknowledge(key, settings.group(), record.getId());
        }

        private boolean awaitStop(long delayMs) {
            try {
                return stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
        }
    }
}
