package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.DimensionAttributes;
import com.premiergroup.ad_warehouse.entity.DimensionRow;
import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.exception.DimensionResolutionException;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Get-or-create mapping from a natural key to the surrogate key of a dimension row.
 * <p>
 * The row is looked up first. When absent, a conditional insert that only writes if
 * no row holds the natural key is issued and the row is looked up again, so the unique
 * constraint on the natural key arbitrates between competing writers. Attributes are
 * only written on creation; an existing row is returned untouched.
 * <p>
 * Must be called inside a transaction.
 *
 * @param <K> natural key type
 * @param <A> creation-time attributes
 */
@Log4j2
public class SurrogateKeyStore<K, A extends DimensionAttributes> {

    @FunctionalInterface
    public interface ConditionalInsert<K, A> {
        int insertIfAbsent(K naturalKey, A attributes);
    }

    private final Dimension dimension;
    private final Predicate<K> completeKey;
    private final Function<K, Optional<? extends DimensionRow>> lookup;
    private final ConditionalInsert<K, A> conditionalInsert;

    public SurrogateKeyStore(Dimension dimension,
                             Predicate<K> completeKey,
                             Function<K, Optional<? extends DimensionRow>> lookup,
                             ConditionalInsert<K, A> conditionalInsert) {
        this.dimension = dimension;
        this.completeKey = completeKey;
        this.lookup = lookup;
        this.conditionalInsert = conditionalInsert;
    }

    public Integer resolve(K naturalKey, A attributes) {
        if (naturalKey == null || !completeKey.test(naturalKey)) {
            throw new DimensionResolutionException(dimension, naturalKey, "natural key is missing or incomplete");
        }
        try {
            Optional<? extends DimensionRow> row = lookup.apply(naturalKey);
            if (row.isEmpty()) {
                int inserted = conditionalInsert.insertIfAbsent(naturalKey, attributes);
                row = lookup.apply(naturalKey);
                if (inserted > 0) {
                    log.debug("Created {} row {} for natural key {}",
                            dimension, row.map(DimensionRow::getSurrogateKey).orElse(null), naturalKey);
                }
            }
            DimensionRow found = row.orElseThrow(() -> new DimensionResolutionException(
                    dimension, naturalKey, "row not visible after conditional insert"));
            checkOwner(found, naturalKey, attributes);
            return found.getSurrogateKey();
        } catch (DataAccessException e) {
            throw new DimensionResolutionException(dimension, naturalKey, e);
        }
    }

    public Dimension getDimension() {
        return dimension;
    }

    private void checkOwner(DimensionRow row, K naturalKey, A attributes) {
        Integer expectedParent = attributes == null ? null : attributes.parentKey();
        if (expectedParent != null && !Objects.equals(expectedParent, row.getParentKey())) {
            throw new DimensionResolutionException(dimension, naturalKey,
                    "row " + row.getSurrogateKey() + " belongs to parent " + row.getParentKey()
                            + ", record resolved parent " + expectedParent);
        }
    }
}
