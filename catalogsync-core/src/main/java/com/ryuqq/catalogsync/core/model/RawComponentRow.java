package com.ryuqq.catalogsync.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 보증 데이터베이스의 SKU 단위 원본 행.
 *
 * <p>조회 계층이 소유하며 코어는 읽기만 합니다. 코드 값(금속 스탬프, 소재 코드 등)은
 * 원본 그대로 보관되고, 표시용 값으로의 변환은
 * {@link com.ryuqq.catalogsync.core.normalize.FieldNormalizer}가 담당합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 변경 불가. {@link #builder(String, GroupId)}로 생성합니다.</p>
 *
 * <p>sku와 groupId를 제외한 모든 필드는 null일 수 있습니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class RawComponentRow {

    private final String sku;
    private final GroupId groupId;
    private final String categoryCode;
    private final String subgroupCode;
    private final String metalStamp;
    private final String metalColor;
    private final String materialCode;
    private final String shapeCode;
    private final String clarityCode;
    private final String cutCode;
    private final String platingCode;
    private final String stoneColor;
    private final String settingType;
    private final String collection;
    private final String jewelryBrand;
    private final String gemstoneBrand;
    private final String styleId;
    private final String webDescriptor;
    private final BigDecimal caratWeight;
    private final String ringSize;
    private final BigDecimal lengthMm;
    private final BigDecimal widthMm;
    private final Integer piecesPer;
    private final String imageSku;
    private final Map<ProductFlag, Boolean> flags;
    private final BigDecimal price;
    private final BigDecimal compareAtPrice;
    private final Integer inventoryQuantity;
    private final BigDecimal weightGrams;
    private final String barcode;

    private RawComponentRow(Builder builder) {
        this.sku = builder.sku;
        this.groupId = builder.groupId;
        this.categoryCode = builder.categoryCode;
        this.subgroupCode = builder.subgroupCode;
        this.metalStamp = builder.metalStamp;
        this.metalColor = builder.metalColor;
        this.materialCode = builder.materialCode;
        this.shapeCode = builder.shapeCode;
        this.clarityCode = builder.clarityCode;
        this.cutCode = builder.cutCode;
        this.platingCode = builder.platingCode;
        this.stoneColor = builder.stoneColor;
        this.settingType = builder.settingType;
        this.collection = builder.collection;
        this.jewelryBrand = builder.jewelryBrand;
        this.gemstoneBrand = builder.gemstoneBrand;
        this.styleId = builder.styleId;
        this.webDescriptor = builder.webDescriptor;
        this.caratWeight = builder.caratWeight;
        this.ringSize = builder.ringSize;
        this.lengthMm = builder.lengthMm;
        this.widthMm = builder.widthMm;
        this.piecesPer = builder.piecesPer;
        this.imageSku = builder.imageSku;
        this.flags = Collections.unmodifiableMap(new EnumMap<>(builder.flags));
        this.price = builder.price;
        this.compareAtPrice = builder.compareAtPrice;
        this.inventoryQuantity = builder.inventoryQuantity;
        this.weightGrams = builder.weightGrams;
        this.barcode = builder.barcode;
    }

    /**
     * Builder 생성.
     *
     * @param sku SKU (Item No.)
     * @param groupId 소속 그룹
     * @return Builder
     * @throws IllegalArgumentException sku가 비어 있거나 groupId가 null인 경우
     */
    public static Builder builder(String sku, GroupId groupId) {
        return new Builder(sku, groupId);
    }

    public String getSku() {
        return sku;
    }

    public GroupId getGroupId() {
        return groupId;
    }

    public String getCategoryCode() {
        return categoryCode;
    }

    public Category getCategory() {
        return Category.fromCode(categoryCode);
    }

    public String getSubgroupCode() {
        return subgroupCode;
    }

    public String getMetalStamp() {
        return metalStamp;
    }

    public String getMetalColor() {
        return metalColor;
    }

    public String getMaterialCode() {
        return materialCode;
    }

    public String getShapeCode() {
        return shapeCode;
    }

    public String getClarityCode() {
        return clarityCode;
    }

    public String getCutCode() {
        return cutCode;
    }

    public String getPlatingCode() {
        return platingCode;
    }

    public String getStoneColor() {
        return stoneColor;
    }

    public String getSettingType() {
        return settingType;
    }

    public String getCollection() {
        return collection;
    }

    public String getJewelryBrand() {
        return jewelryBrand;
    }

    public String getGemstoneBrand() {
        return gemstoneBrand;
    }

    public String getStyleId() {
        return styleId;
    }

    public String getWebDescriptor() {
        return webDescriptor;
    }

    public BigDecimal getCaratWeight() {
        return caratWeight;
    }

    public String getRingSize() {
        return ringSize;
    }

    public BigDecimal getLengthMm() {
        return lengthMm;
    }

    public BigDecimal getWidthMm() {
        return widthMm;
    }

    public Integer getPiecesPer() {
        return piecesPer;
    }

    public String getImageSku() {
        return imageSku;
    }

    /**
     * 플래그 값 조회.
     *
     * @param flag 플래그
     * @return 값, 원본에 없으면 null
     */
    public Boolean getFlag(ProductFlag flag) {
        return flags.get(flag);
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getCompareAtPrice() {
        return compareAtPrice;
    }

    public Integer getInventoryQuantity() {
        return inventoryQuantity;
    }

    public BigDecimal getWeightGrams() {
        return weightGrams;
    }

    public String getBarcode() {
        return barcode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawComponentRow that = (RawComponentRow) o;
        return sku.equals(that.sku) && groupId.equals(that.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sku, groupId);
    }

    @Override
    public String toString() {
        return "RawComponentRow{sku=" + sku + ", groupId=" + groupId.getValue() + ", category=" + categoryCode + '}';
    }

    /**
     * RawComponentRow Builder.
     */
    public static final class Builder {

        private final String sku;
        private final GroupId groupId;
        private String categoryCode;
        private String subgroupCode;
        private String metalStamp;
        private String metalColor;
        private String materialCode;
        private String shapeCode;
        private String clarityCode;
        private String cutCode;
        private String platingCode;
        private String stoneColor;
        private String settingType;
        private String collection;
        private String jewelryBrand;
        private String gemstoneBrand;
        private String styleId;
        private String webDescriptor;
        private BigDecimal caratWeight;
        private String ringSize;
        private BigDecimal lengthMm;
        private BigDecimal widthMm;
        private Integer piecesPer;
        private String imageSku;
        private final Map<ProductFlag, Boolean> flags = new EnumMap<>(ProductFlag.class);
        private BigDecimal price;
        private BigDecimal compareAtPrice;
        private Integer inventoryQuantity;
        private BigDecimal weightGrams;
        private String barcode;

        private Builder(String sku, GroupId groupId) {
            if (sku == null || sku.isBlank()) {
                throw new IllegalArgumentException("sku cannot be null or blank");
            }
            if (groupId == null) {
                throw new IllegalArgumentException("groupId cannot be null");
            }
            this.sku = sku.trim();
            this.groupId = groupId;
        }

        public Builder category(String categoryCode) {
            this.categoryCode = categoryCode;
            return this;
        }

        public Builder subgroup(String subgroupCode) {
            this.subgroupCode = subgroupCode;
            return this;
        }

        public Builder metal(String metalStamp, String metalColor) {
            this.metalStamp = metalStamp;
            this.metalColor = metalColor;
            return this;
        }

        public Builder material(String materialCode) {
            this.materialCode = materialCode;
            return this;
        }

        public Builder shape(String shapeCode) {
            this.shapeCode = shapeCode;
            return this;
        }

        public Builder clarity(String clarityCode) {
            this.clarityCode = clarityCode;
            return this;
        }

        public Builder cut(String cutCode) {
            this.cutCode = cutCode;
            return this;
        }

        public Builder plating(String platingCode) {
            this.platingCode = platingCode;
            return this;
        }

        public Builder stoneColor(String stoneColor) {
            this.stoneColor = stoneColor;
            return this;
        }

        public Builder settingType(String settingType) {
            this.settingType = settingType;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder jewelryBrand(String jewelryBrand) {
            this.jewelryBrand = jewelryBrand;
            return this;
        }

        public Builder gemstoneBrand(String gemstoneBrand) {
            this.gemstoneBrand = gemstoneBrand;
            return this;
        }

        public Builder styleId(String styleId) {
            this.styleId = styleId;
            return this;
        }

        public Builder webDescriptor(String webDescriptor) {
            this.webDescriptor = webDescriptor;
            return this;
        }

        public Builder caratWeight(BigDecimal caratWeight) {
            this.caratWeight = caratWeight;
            return this;
        }

        public Builder caratWeight(String caratWeight) {
            return caratWeight(caratWeight == null ? null : new BigDecimal(caratWeight));
        }

        public Builder ringSize(String ringSize) {
            this.ringSize = ringSize;
            return this;
        }

        public Builder dimensions(BigDecimal lengthMm, BigDecimal widthMm) {
            this.lengthMm = lengthMm;
            this.widthMm = widthMm;
            return this;
        }

        public Builder piecesPer(Integer piecesPer) {
            this.piecesPer = piecesPer;
            return this;
        }

        public Builder imageSku(String imageSku) {
            this.imageSku = imageSku;
            return this;
        }

        public Builder flag(ProductFlag flag, Boolean value) {
            if (flag == null) {
                throw new IllegalArgumentException("flag cannot be null");
            }
            if (value == null) {
                flags.remove(flag);
            } else {
                flags.put(flag, value);
            }
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder compareAtPrice(BigDecimal compareAtPrice) {
            this.compareAtPrice = compareAtPrice;
            return this;
        }

        public Builder inventoryQuantity(Integer inventoryQuantity) {
            this.inventoryQuantity = inventoryQuantity;
            return this;
        }

        public Builder weightGrams(BigDecimal weightGrams) {
            this.weightGrams = weightGrams;
            return this;
        }

        public Builder barcode(String barcode) {
            this.barcode = barcode;
            return this;
        }

        public RawComponentRow build() {
            return new RawComponentRow(this);
        }
    }
}
