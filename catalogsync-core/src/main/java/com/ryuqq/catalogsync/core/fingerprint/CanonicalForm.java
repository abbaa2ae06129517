package com.ryuqq.catalogsync.core.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogVariant;
import com.ryuqq.catalogsync.core.catalog.Metafield;
import com.ryuqq.catalogsync.core.catalog.VariantOption;
import com.ryuqq.catalogsync.core.model.MediaRef;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link CatalogEntity}의 정규 JSON 표현.
 *
 * <p>필드는 고정 순서로 기록하고, 순서가 의미 없는 메타필드는 (namespace, key) 순으로 정렬합니다.
 * 옵션/변형/미디어는 이미 결정적 순서이므로 그대로 유지합니다.
 * 금액/무게는 끝자리 0을 제거해 표기 차이가 지문에 영향을 주지 않게 합니다.</p>
 *
 * <p>한 줄 JSON이므로 벌크 작업의 JSON Lines 페이로드로도 사용됩니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class CanonicalForm {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Comparator<Metafield> METAFIELD_ORDER =
        Comparator.comparing(Metafield::namespace).thenComparing(Metafield::key);

    public ObjectNode toTree(CatalogEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put("groupId", entity.groupId().getValue());
        root.put("handle", entity.handle());
        root.put("title", entity.title());
        root.put("productType", entity.productType());
        root.put("description", entity.description());
        root.put("vendor", entity.vendor());
        root.put("status", entity.status());

        ArrayNode options = root.putArray("options");
        for (VariantOption option : entity.options()) {
            ObjectNode node = options.addObject();
            node.put("name", option.name());
            ArrayNode values = node.putArray("values");
            option.values().forEach(values::add);
        }

        writeMetafields(root.putArray("metafields"), entity.metafields());

        ArrayNode variants = root.putArray("variants");
        for (CatalogVariant variant : entity.variants()) {
            ObjectNode node = variants.addObject();
            node.put("sku", variant.sku());
            ArrayNode values = node.putArray("optionValues");
            variant.optionValues().forEach(values::add);
            node.put("price", plain(variant.price()));
            node.put("compareAtPrice", plain(variant.compareAtPrice()));
            node.put("inventoryQuantity", variant.inventoryQuantity());
            node.put("weightGrams", plain(variant.weightGrams()));
            node.put("barcode", variant.barcode());
            writeMetafields(node.putArray("metafields"), variant.metafields());
        }

        ArrayNode media = root.putArray("media");
        for (MediaRef ref : entity.media()) {
            ObjectNode node = media.addObject();
            node.put("uri", ref.uri());
            node.put("altText", ref.altText());
        }
        return root;
    }

    /**
     * 한 줄 JSON 문자열.
     *
     * @throws IllegalStateException 직렬화 실패 (트리 노드만 쓰므로 발생하지 않아야 함)
     */
    public String toJson(CatalogEntity entity) {
        try {
            return MAPPER.writeValueAsString(toTree(entity));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entity " + entity.handle(), e);
        }
    }

    private static void writeMetafields(ArrayNode target, List<Metafield> metafields) {
        List<Metafield> sorted = new ArrayList<>(metafields);
        sorted.sort(METAFIELD_ORDER);
        for (Metafield metafield : sorted) {
            ObjectNode node = target.addObject();
            node.put("namespace", metafield.namespace());
            node.put("key", metafield.key());
            node.put("type", metafield.type());
            node.put("value", metafield.value());
        }
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
