package com.ryuqq.catalogsync.adapter.inmemory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogVariant;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.fingerprint.RemoteState;
import com.ryuqq.catalogsync.core.fingerprint.SyncFingerprint;
import com.ryuqq.catalogsync.core.model.MediaRef;
import com.ryuqq.catalogsync.core.outcome.Fail;
import com.ryuqq.catalogsync.core.outcome.Ok;
import com.ryuqq.catalogsync.core.outcome.Outcome;
import com.ryuqq.catalogsync.core.spi.BulkOperation;
import com.ryuqq.catalogsync.core.spi.BulkStatus;
import com.ryuqq.catalogsync.core.spi.CatalogPlatform;
import com.ryuqq.catalogsync.core.spi.FieldError;
import com.ryuqq.catalogsync.core.spi.UpsertRequest;
import com.ryuqq.catalogsync.core.spi.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link CatalogPlatform} for testing and local runs.
 *
 * <p>Products are keyed by handle, so repeating an upsert for the same handle updates
 * the stored product instead of creating a second one.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>products:</strong> ConcurrentHashMap&lt;String, StoredProduct&gt; - handle → platform id, fingerprint, media</li>
 *   <li><strong>bulkJobs:</strong> ConcurrentHashMap&lt;String, BulkJob&gt; - operation id → pending bulk job</li>
 *   <li><strong>scripted responses:</strong> queues consumed before the default behavior, for failure injection</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCatalogPlatform platform = new InMemoryCatalogPlatform();
 *
 * // 다음 upsert 한 번은 429 응답처럼 동작
 * platform.enqueueUpsertResponse(Retry.after("429 Too Many Requests", 2000));
 *
 * // 특정 핸들은 저장하되 필드 오류를 함께 반환 (부분 실패)
 * platform.rejectFields("solitaire-ring-r100", List.of(new FieldError("metafields.shape", "INVALID", "bad value")));
 *
 * // 벌크 작업은 두 번 RUNNING 후 완료
 * platform.setBulkPollsBeforeCompletion(2);
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public class InMemoryCatalogPlatform implements CatalogPlatform {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogPlatform.class);

    private static final String PRODUCT_ID_PREFIX = "gid://catalog/Product/";
    private static final String VARIANT_ID_PREFIX = "gid://catalog/ProductVariant/";

    private final ObjectMapper mapper = new ObjectMapper();

    private final ConcurrentHashMap<String, StoredProduct> products = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BulkJob> bulkJobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<FieldError>> fieldRejections = new ConcurrentHashMap<>();

    private final Queue<Outcome<RemoteState>> lookupResponses = new ConcurrentLinkedQueue<>();
    private final Queue<Outcome<UpsertResult>> upsertResponses = new ConcurrentLinkedQueue<>();
    private final Queue<Outcome<BulkOperation>> submitResponses = new ConcurrentLinkedQueue<>();

    private final AtomicLong idSequence = new AtomicLong();
    private final AtomicInteger lookupCount = new AtomicInteger();
    private final AtomicInteger upsertCount = new AtomicInteger();
    private final AtomicInteger bulkSubmitCount = new AtomicInteger();
    private final AtomicInteger bulkPollCount = new AtomicInteger();

    private volatile int bulkPollsBeforeCompletion;
    private volatile String bulkFailureMessage;

    @Override
    public Outcome<RemoteState> findRemoteState(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("handle cannot be null or blank");
        }
        lookupCount.incrementAndGet();
        Outcome<RemoteState> scripted = lookupResponses.poll();
        if (scripted != null) {
            return scripted;
        }
        StoredProduct product = products.get(handle);
        if (product == null) {
            return Ok.of(RemoteState.none());
        }
        return Ok.of(new RemoteState(product.platformId(), product.fingerprint(), product.mediaUris()));
    }

    @Override
    public Outcome<UpsertResult> upsert(UpsertRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        upsertCount.incrementAndGet();
        Outcome<UpsertResult> scripted = upsertResponses.poll();
        if (scripted != null) {
            return scripted;
        }
        CatalogEntity entity = request.entity();
        Set<String> mediaUris = new LinkedHashSet<>();
        for (MediaRef ref : entity.media()) {
            mediaUris.add(ref.uri());
        }
        List<String> skus = entity.variants().stream().map(CatalogVariant::sku).toList();
        return Ok.of(store(entity.handle(), request.fingerprint(), mediaUris, skus));
    }

    /**
     * {@inheritDoc}
     *
     * <p>각 줄은 {@code handle}, {@code fingerprint}, {@code media[].uri}, {@code variants[].sku}를
     * 가진 JSON 객체여야 합니다. 형식이 잘못된 줄이 있으면 작업 전체를 거부합니다.</p>
     */
    @Override
    public Outcome<BulkOperation> submitBulk(List<String> serializedEntities) {
        if (serializedEntities == null || serializedEntities.isEmpty()) {
            throw new IllegalArgumentException("serializedEntities cannot be null or empty");
        }
        bulkSubmitCount.incrementAndGet();
        Outcome<BulkOperation> scripted = submitResponses.poll();
        if (scripted != null) {
            return scripted;
        }

        List<BulkLine> lines = new ArrayList<>(serializedEntities.size());
        for (String serialized : serializedEntities) {
            try {
                lines.add(parseLine(mapper.readTree(serialized)));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return Fail.of(ErrorKind.REMOTE_REJECTION, "Malformed bulk line: " + e.getMessage());
            }
        }

        String operationId = "bulk-" + idSequence.incrementAndGet();
        BulkJob job = new BulkJob(lines, bulkPollsBeforeCompletion, bulkFailureMessage);
        bulkJobs.put(operationId, job);
        log.debug("Accepted bulk operation {} with {} lines", operationId, lines.size());
        return Ok.of(new BulkOperation(operationId, lines.stream().map(BulkLine::handle).toList()));
    }

    /**
     * {@inheritDoc}
     *
     * <p>완료 시점에 한 번만 저장을 적용하고, 이후 폴링은 같은 결과를 돌려줍니다.</p>
     */
    @Override
    public Outcome<BulkStatus> pollBulk(BulkOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        bulkPollCount.incrementAndGet();
        BulkJob job = bulkJobs.get(operation.operationId());
        if (job == null) {
            return Fail.of(ErrorKind.REMOTE_REJECTION, "Unknown bulk operation: " + operation.operationId());
        }
        synchronized (job) {
            if (job.remainingPolls > 0) {
                job.remainingPolls--;
                return Ok.of(BulkStatus.running());
            }
            if (job.failureMessage != null) {
                return Ok.of(BulkStatus.failed(job.failureMessage));
            }
            if (job.results == null) {
                Map<String, UpsertResult> results = new LinkedHashMap<>();
                for (BulkLine line : job.lines) {
                    results.put(line.handle(), store(line.handle(), line.fingerprint(), line.mediaUris(), line.skus()));
                }
                job.results = results;
            }
            return Ok.of(BulkStatus.completed(job.results));
        }
    }

    // ============================================================
    // Failure injection
    // ============================================================

    public void enqueueLookupResponse(Outcome<RemoteState> response) {
        lookupResponses.add(response);
    }

    public void enqueueUpsertResponse(Outcome<UpsertResult> response) {
        upsertResponses.add(response);
    }

    public void enqueueSubmitResponse(Outcome<BulkOperation> response) {
        submitResponses.add(response);
    }

    /**
     * 해당 핸들의 저장은 성공시키되 필드 오류를 함께 반환합니다.
     */
    public void rejectFields(String handle, List<FieldError> errors) {
        fieldRejections.put(handle, List.copyOf(errors));
    }

    /**
     * 이후 제출되는 벌크 작업이 완료 전에 RUNNING을 반환할 횟수.
     */
    public void setBulkPollsBeforeCompletion(int polls) {
        if (polls < 0) {
            throw new IllegalArgumentException("polls must be non-negative (current: " + polls + ")");
        }
        this.bulkPollsBeforeCompletion = polls;
    }

    /**
     * 이후 제출되는 벌크 작업을 FAILED로 끝냅니다. null이면 정상 완료.
     */
    public void setBulkFailureMessage(String message) {
        this.bulkFailureMessage = message;
    }

    // ============================================================
    // Inspection
    // ============================================================

    public SyncFingerprint getFingerprint(String handle) {
        StoredProduct product = products.get(handle);
        return product == null ? null : product.fingerprint();
    }

    public String getPlatformId(String handle) {
        StoredProduct product = products.get(handle);
        return product == null ? null : product.platformId();
    }

    public int productCount() {
        return products.size();
    }

    public int lookupCount() {
        return lookupCount.get();
    }

    public int upsertCount() {
        return upsertCount.get();
    }

    public int bulkSubmitCount() {
        return bulkSubmitCount.get();
    }

    public int bulkPollCount() {
        return bulkPollCount.get();
    }

    /**
     * 저장된 상품, 스크립트된 응답, 카운터를 모두 초기화합니다.
     */
    public void clear() {
        products.clear();
        bulkJobs.clear();
        fieldRejections.clear();
        lookupResponses.clear();
        upsertResponses.clear();
        submitResponses.clear();
        lookupCount.set(0);
        upsertCount.set(0);
        bulkSubmitCount.set(0);
        bulkPollCount.set(0);
        bulkPollsBeforeCompletion = 0;
        bulkFailureMessage = null;
    }

    private UpsertResult store(String handle, SyncFingerprint fingerprint, Set<String> mediaUris, List<String> skus) {
        StoredProduct stored = products.compute(handle, (key, existing) -> {
            String platformId = existing == null
                ? PRODUCT_ID_PREFIX + idSequence.incrementAndGet()
                : existing.platformId();
            Set<String> media = new LinkedHashSet<>(mediaUris);
            if (existing != null) {
                media.addAll(existing.mediaUris());
            }
            return new StoredProduct(platformId, fingerprint, Set.copyOf(media));
        });

        List<String> variantIds = new ArrayList<>(skus.size());
        for (String sku : skus) {
            variantIds.add(VARIANT_ID_PREFIX + sku);
        }
        List<FieldError> rejected = fieldRejections.get(handle);
        log.debug("Stored {} as {} ({} variants)", handle, stored.platformId(), skus.size());
        return new UpsertResult(stored.platformId(), variantIds, rejected);
    }

    private static BulkLine parseLine(JsonNode node) {
        String handle = node.path("handle").asText(null);
        String fingerprint = node.path("fingerprint").asText(null);
        if (handle == null || handle.isBlank() || fingerprint == null) {
            throw new IllegalArgumentException("Bulk line requires handle and fingerprint");
        }
        Set<String> mediaUris = new LinkedHashSet<>();
        for (JsonNode media : node.path("media")) {
            mediaUris.add(media.path("uri").asText());
        }
        List<String> skus = new ArrayList<>();
        for (JsonNode variant : node.path("variants")) {
            skus.add(variant.path("sku").asText());
        }
        return new BulkLine(handle, SyncFingerprint.of(fingerprint), mediaUris, skus);
    }

    private record StoredProduct(String platformId, SyncFingerprint fingerprint, Set<String> mediaUris) {
    }

    private record BulkLine(String handle, SyncFingerprint fingerprint, Set<String> mediaUris, List<String> skus) {
    }

    private static final class BulkJob {
        private final List<BulkLine> lines;
        private final String failureMessage;
        private int remainingPolls;
        private Map<String, UpsertResult> results;

        private BulkJob(List<BulkLine> lines, int remainingPolls, String failureMessage) {
            this.lines = lines;
            this.remainingPolls = remainingPolls;
            this.failureMessage = failureMessage;
        }
    }
}
