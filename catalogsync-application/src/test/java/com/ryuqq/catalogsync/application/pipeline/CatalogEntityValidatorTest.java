package com.ryuqq.catalogsync.application.pipeline;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;
import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.catalog.CatalogVariant;
import com.ryuqq.catalogsync.core.catalog.Metafield;
import com.ryuqq.catalogsync.core.catalog.VariantOption;
import com.ryuqq.catalogsync.core.classify.AttributeKey;
import com.ryuqq.catalogsync.core.error.CatalogValidationException;
import com.ryuqq.catalogsync.core.error.ErrorKind;
import com.ryuqq.catalogsync.core.model.GroupId;
import com.ryuqq.catalogsync.testkit.fixture.RowFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * CatalogEntityValidator 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class CatalogEntityValidatorTest {

    private static final VariantOption SIZE = new VariantOption(AttributeKey.RING_SIZE, "Size", List.of("5.0", "6.0"));

    private final CatalogEntityValidator validator = new CatalogEntityValidator(new CatalogSettings());

    @Test
    void validate_BuiltEntity_Passes() {
        CatalogEntity entity = RowFixtures.entity(RowFixtures.ringGroup("GRP-R100", "5", "6", "6.5"));

        assertThatCode(() -> validator.validate(entity)).doesNotThrowAnyException();
    }

    @Test
    void validate_CollectsAllViolations() {
        // given
        CatalogEntity entity = entity(" ", List.of(SIZE), List.of(
            variant("R100-5", List.of("5.0"), "-1.00"),
            variant(" ", List.of(), "10.00")
        ));

        // when
        CatalogValidationException exception = catchThrowableOfType(
            () -> validator.validate(entity), CatalogValidationException.class);

        // then
        assertThat(exception.getErrorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(exception.getDetails()).containsExactly(
            "Product title is required",
            "Variant 1: price cannot be negative",
            "Variant 2: SKU is required",
            "Variant 2: expected 1 option values, found 0");
    }

    @Test
    void validate_NoVariants_Fails() {
        CatalogValidationException exception = catchThrowableOfType(
            () -> validator.validate(entity("Ring", List.of(), List.of())), CatalogValidationException.class);

        assertThat(exception.getDetails()).containsExactly("At least one variant is required");
    }

    @Test
    void validate_DuplicateOptionTuple_FailsAsDuplicateVariant() {
        // given
        CatalogEntity entity = entity("Ring", List.of(SIZE), List.of(
            variant("R100-5A", List.of("5.0"), "10.00"),
            variant("R100-5B", List.of("5.0"), "10.00")
        ));

        // when
        CatalogValidationException exception = catchThrowableOfType(
            () -> validator.validate(entity), CatalogValidationException.class);

        // then
        assertThat(exception.getErrorKind()).isEqualTo(ErrorKind.DUPLICATE_VARIANT);
        assertThat(exception.getDetails()).singleElement().asString().contains("R100-5A", "R100-5B");
    }

    @Test
    void validate_IncompleteMetafield_Fails() {
        // given
        CatalogEntity entity = entity("Ring", List.of(SIZE), List.of(
            new CatalogVariant("R100-5", List.of("5.0"), BigDecimal.TEN, null, 1, null, null,
                List.of(new Metafield(Metafield.VARIANT_NAMESPACE, "clarity_grade", "single_line_text_field", ""))),
            variant("R100-6", List.of("6.0"), "10.00")
        ));

        // when
        CatalogValidationException exception = catchThrowableOfType(
            () -> validator.validate(entity), CatalogValidationException.class);

        // then
        assertThat(exception.getDetails()).singleElement().asString().startsWith("Variant 1 metafield 1");
    }

    @Test
    void validate_TooManyOptionsAndLongTitle_Fail() {
        // given
        CatalogEntityValidator strict = new CatalogEntityValidator(new CatalogSettings().withMaxOptions(1));
        VariantOption metal = new VariantOption(AttributeKey.METAL_TYPE, "Metal Type", List.of("14K White Gold"));
        CatalogEntity entity = entity("R".repeat(300), List.of(SIZE, metal), List.of(
            variant("R100-5", List.of("5.0", "14K White Gold"), "10.00"),
            variant("R100-6", List.of("6.0", "14K White Gold"), "10.00")
        ));

        // when
        CatalogValidationException exception = catchThrowableOfType(
            () -> strict.validate(entity), CatalogValidationException.class);

        // then
        assertThat(exception.getDetails()).containsExactly(
            "Product title exceeds 255 characters",
            "Product has 2 options, maximum is 1");
    }

    private static CatalogEntity entity(String title, List<VariantOption> options,
                                        List<CatalogVariant> variants) {
        return new CatalogEntity(GroupId.of("GRP-R100"), title, "ring-grp-r100", "Ring", "", "Charles Colvard",
            "ACTIVE", Map.of(), Map.of(), options, variants, List.of());
    }

    private static CatalogVariant variant(String sku, List<String> optionValues, String price) {
        return new CatalogVariant(sku, optionValues, new BigDecimal(price), null, 1, null, null, List.of());
    }
}
