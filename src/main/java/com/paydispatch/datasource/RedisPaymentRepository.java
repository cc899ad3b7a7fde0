package com.paydispatch.datasource;

import com.paydispatch.entity.AuditEntry;
import com.paydispatch.entity.Payment;
import com.paydispatch.entity.PaymentSummary;
import com.paydispatch.entity.PersistedPayment;
import com.paydispatch.entity.Processor;
import com.paydispatch.repository.PaymentRepository;
import com.paydispatch.repository.PaymentRepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Payments hash plus per-processor counters, updated together by one Lua script. Amounts
 * are kept in cents.
 */
public class RedisPaymentRepository implements PaymentRepository {
    private static final Logger log = LoggerFactory.getLogger(RedisPaymentRepository.class);

    private static final String PAYMENTS_KEY = "payments";
    private static final String PAYMENTS_BY_TIME_KEY = "payments_by_time";
    private static final String SUMMARY_KEY = "payment_summary";
    private static final String AUDIT_LOG_KEY = "payment_audit_log";

    // KEYS: payments, payments_by_time, payment_summary
    // ARGV: correlationId, processor, cents, createdAtMillis
    private static final String SAVE_LUA_SCRIPT =
            "if redis.call('HSETNX', KEYS[1], ARGV[1], ARGV[2] .. ':' .. ARGV[3] .. ':' .. ARGV[4]) == 0 then\n" +
                    "    return 0\n" +
                    "end\n" +
                    "redis.call('ZADD', KEYS[2], ARGV[4], ARGV[2] .. ':' .. ARGV[3] .. ':' .. ARGV[1])\n" +
                    "redis.call('HINCRBY', KEYS[3], ARGV[2] .. '_count', 1)\n" +
                    "redis.call('HINCRBY', KEYS[3], ARGV[2] .. '_total_cents', ARGV[3])\n" +
                    "return 1";

    private static final String SUMMARY_LUA_SCRIPT =
            "local payments = redis.call('ZRANGEBYSCORE', KEYS[1], ARGV[1], ARGV[2])\n" +
                    "local default_cents = 0\n" +
                    "local fallback_cents = 0\n" +
                    "local default_count = 0\n" +
                    "local fallback_count = 0\n" +
                    "for i, member in ipairs(payments) do\n" +
                    "    local processor, cents = string.match(member, '^([^:]+):([^:]+):')\n" +
                    "    local amount = tonumber(cents)\n" +
                    "    if processor == 'default' then\n" +
                    "        default_count = default_count + 1\n" +
                    "        default_cents = default_cents + amount\n" +
                    "    else\n" +
                    "        fallback_count = fallback_count + 1\n" +
                    "        fallback_cents = fallback_cents + amount\n" +
                    "    end\n" +
                    "end\n" +
                    "return {tostring(default_count), tostring(default_cents), tostring(fallback_count), tostring(fallback_cents)}";

    private final JedisPool jedisPool;
    private final String saveScriptSha;
    private final String summaryScriptSha;

    public RedisPaymentRepository(String host, int port) {
        this(createPool(host, port));
    }

    public RedisPaymentRepository(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
        try (Jedis jedis = jedisPool.getResource()) {
            this.saveScriptSha = jedis.scriptLoad(SAVE_LUA_SCRIPT);
            this.summaryScriptSha = jedis.scriptLoad(SUMMARY_LUA_SCRIPT);
        } catch (JedisException e) {
            jedisPool.close();
            throw new PaymentRepositoryException("Could not connect to Valkey", e);
        }
    }

    private static JedisPool createPool(String host, int port) {
        final JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(200);
        poolConfig.setMaxIdle(200);
        poolConfig.setMinIdle(16);
        poolConfig.setBlockWhenExhausted(true);
        return new JedisPool(poolConfig, host, port, 2000);
    }

    @Override
    public boolean saveIfAbsent(Payment payment, Processor processor) {
        long createdAt = System.currentTimeMillis();
        List<String> keys = List.of(PAYMENTS_KEY, PAYMENTS_BY_TIME_KEY, SUMMARY_KEY);
        List<String> args = List.of(
                payment.correlationId(),
                processor.jsonName(),
                String.valueOf(toCents(payment.amount())),
                String.valueOf(createdAt));

        try (Jedis jedis = jedisPool.getResource()) {
            Object inserted = jedis.evalsha(saveScriptSha, keys, args);
            return Long.valueOf(1L).equals(inserted);
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Failed to save payment " + payment.correlationId(), e);
        }
    }

    @Override
    public Optional<PersistedPayment> findByCorrelationId(String correlationId) {
        try (Jedis jedis = jedisPool.getResource()) {
            String row = jedis.hget(PAYMENTS_KEY, correlationId);
            if (row == null) {
                return Optional.empty();
            }
            String[] parts = row.split(":");
            return Optional.of(new PersistedPayment(
                    correlationId,
                    BigDecimal.valueOf(Long.parseLong(parts[1]), 2),
                    Processor.fromJsonName(parts[0]),
                    Instant.ofEpochMilli(Long.parseLong(parts[2]))));
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Failed to look up payment " + correlationId, e);
        }
    }

    @Override
    public PaymentSummary getPaymentsSummary(Instant from, Instant to) {
        try (Jedis jedis = jedisPool.getResource()) {
            if (from == null && to == null) {
                Map<String, String> summaryData = jedis.hgetAll(SUMMARY_KEY);
                long defaultCount = Long.parseLong(summaryData.getOrDefault("default_count", "0"));
                long defaultTotalCents = Long.parseLong(summaryData.getOrDefault("default_total_cents", "0"));
                long fallbackCount = Long.parseLong(summaryData.getOrDefault("fallback_count", "0"));
                long fallbackTotalCents = Long.parseLong(summaryData.getOrDefault("fallback_total_cents", "0"));

                return new PaymentSummary(
                        new PaymentSummary.ProcessorSummary(defaultCount, BigDecimal.valueOf(defaultTotalCents, 2)),
                        new PaymentSummary.ProcessorSummary(fallbackCount, BigDecimal.valueOf(fallbackTotalCents, 2))
                );
            }

            String fromScore = from == null ? "-inf" : String.valueOf(from.toEpochMilli());
            String toScore = to == null ? "+inf" : String.valueOf(to.toEpochMilli());

            @SuppressWarnings("unchecked")
            List<String> result = (List<String>) jedis.evalsha(summaryScriptSha,
                    List.of(PAYMENTS_BY_TIME_KEY), List.of(fromScore, toScore));

            long defaultCount = Long.parseLong(result.get(0));
            long defaultCents = Long.parseLong(result.get(1));
            long fallbackCount = Long.parseLong(result.get(2));
            long fallbackCents = Long.parseLong(result.get(3));

            return new PaymentSummary(
                    new PaymentSummary.ProcessorSummary(defaultCount, BigDecimal.valueOf(defaultCents, 2)),
                    new PaymentSummary.ProcessorSummary(fallbackCount, BigDecimal.valueOf(fallbackCents, 2))
            );
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Failed to read payment summary", e);
        }
    }

    @Override
    public void purgeAllData() {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(PAYMENTS_KEY, PAYMENTS_BY_TIME_KEY, SUMMARY_KEY, AUDIT_LOG_KEY);
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Failed to purge payments", e);
        }
    }

    @Override
    public int appendAuditLog(List<AuditEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            Pipeline p = jedis.pipelined();
            List<Response<Long>> responses = new ArrayList<>(entries.size());
            for (AuditEntry entry : entries) {
                String value = toCents(entry.amount()) + ":" + entry.receivedAt().toEpochMilli();
                responses.add(p.hsetnx(AUDIT_LOG_KEY, entry.correlationId(), value));
            }
            p.sync();

            int written = 0;
            for (Response<Long> response : responses) {
                if (response.get() == 1L) {
                    written++;
                }
            }
            return written;
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Failed to append " + entries.size() + " audit entries", e);
        }
    }

    @Override
    public void verifyConnectivity() {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
        } catch (JedisException e) {
            throw new PaymentRepositoryException("Could not connect to Valkey", e);
        }
    }

    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.debug("Valkey pool closed");
        }
    }

    static long toCents(BigDecimal amount) {
        try {
            return amount.setScale(2, RoundingMode.UNNECESSARY).movePointRight(2).longValueExact();
        } catch (ArithmeticException e) {
            throw new PaymentRepositoryException("Amount cannot be stored as cents: " + amount, e);
        }
    }
}
