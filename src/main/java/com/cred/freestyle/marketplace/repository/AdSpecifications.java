package com.cred.freestyle.marketplace.repository;

import com.cred.freestyle.marketplace.domain.model.Ad;
import com.cred.freestyle.marketplace.domain.model.Ad.AdStatus;
import com.cred.freestyle.marketplace.domain.model.Ad.PremiumType;
import com.cred.freestyle.marketplace.domain.model.Category;
import com.cred.freestyle.marketplace.domain.model.Location;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JPA specifications for the public ad listing.
 *
 * Ranking:
 * - Premium ads (any tier except BASIC) come before BASIC ads
 * - Within each group, newest first (created_at desc)
 *
 * Tiers are not ranked against each other: VIP and BOOSTED share the premium group.
 *
 * A client ordering (created_at, price or views_count, "-" prefix for descending,
 * comma-separated) replaces the ranking entirely.
 *
 * @author Marketplace Team
 */
public final class AdSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private static final Map<String, String> ORDERING_FIELDS = Map.of(
            "created_at", "createdAt",
            "price", "price",
            "views_count", "viewsCount");

    private AdSpecifications() {
    }

    /**
     * Build the listing specification: filters plus premium-first ordering.
     * Ordering is only applied to the row query, not to the page count query.
     *
     * @param criteria Listing filters
     * @return Specification for {@link AdRepository#findAll(Specification, org.springframework.data.domain.Pageable)}
     */
    public static Specification<Ad> listing(AdSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = buildPredicates(criteria, root, cb);

            Class<?> resultType = query.getResultType();
            if (!Long.class.equals(resultType) && !long.class.equals(resultType)) {
                Sort ordering = criteria == null ? null : criteria.getOrdering();
                if (ordering != null && ordering.isSorted()) {
                    query.orderBy(clientOrders(ordering, root, cb));
                } else {
                    Expression<Integer> tierRank = cb.<Integer>selectCase()
                            .when(cb.equal(root.get("premiumType"), PremiumType.BASIC), cb.literal(1))
                            .otherwise(cb.literal(0));
                    query.orderBy(cb.asc(tierRank), cb.desc(root.get("createdAt")));
                }
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Parse the listing's ordering parameter, e.g. "-price" or "views_count,-created_at".
     *
     * @param ordering Raw parameter value, may be null or blank
     * @return Parsed ordering, unsorted when the value is blank
     * @throws IllegalArgumentException if a field cannot be ordered by
     */
    public static Sort parseOrdering(String ordering) {
        if (!hasText(ordering)) {
            return Sort.unsorted();
        }

        List<Sort.Order> orders = new ArrayList<>();
        for (String token : ordering.split(",")) {
            String field = token.trim();
            if (field.isEmpty()) {
                continue;
            }
            boolean descending = field.startsWith("-");
            String name = descending ? field.substring(1) : field;
            String property = ORDERING_FIELDS.get(name);
            if (property == null) {
                throw new IllegalArgumentException("Cannot order ads by '" + name
                        + "'. Allowed fields: created_at, price, views_count");
            }
            orders.add(descending ? Sort.Order.desc(property) : Sort.Order.asc(property));
        }
        return Sort.by(orders);
    }

    private static List<Order> clientOrders(Sort ordering, Root<Ad> root, CriteriaBuilder cb) {
        List<Order> orders = new ArrayList<>();
        boolean byCreatedAt = false;
        for (Sort.Order order : ordering) {
            Expression<?> path = root.get(order.getProperty());
            orders.add(order.isDescending() ? cb.desc(path) : cb.asc(path));
            byCreatedAt |= "createdAt".equals(order.getProperty());
        }
        // Ties fall back to newest first
        if (!byCreatedAt) {
            orders.add(cb.desc(root.get("createdAt")));
        }
        return orders;
    }

    private static List<Predicate> buildPredicates(AdSearchCriteria criteria, Root<Ad> root, CriteriaBuilder cb) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("status"), AdStatus.ACTIVE));

        if (criteria == null) {
            return predicates;
        }

        if (criteria.getPriceMin() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.<BigDecimal>get("price"), criteria.getPriceMin()));
        }
        if (criteria.getPriceMax() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.<BigDecimal>get("price"), criteria.getPriceMax()));
        }

        if (hasText(criteria.getCategoryId()) || hasText(criteria.getCategorySlug())) {
            Join<Ad, Category> category = root.join("category", JoinType.INNER);
            if (hasText(criteria.getCategoryId())) {
                predicates.add(cb.equal(category.get("categoryId"), criteria.getCategoryId()));
            }
            if (hasText(criteria.getCategorySlug())) {
                predicates.add(cb.equal(category.get("slug"), criteria.getCategorySlug()));
            }
        }

        if (hasText(criteria.getCity()) || hasText(criteria.getCounty())) {
            Join<Ad, Location> location = root.join("location", JoinType.INNER);
            if (hasText(criteria.getCity())) {
                predicates.add(cb.equal(cb.lower(location.<String>get("city")),
                        criteria.getCity().trim().toLowerCase(Locale.ROOT)));
            }
            if (hasText(criteria.getCounty())) {
                predicates.add(cb.equal(cb.lower(location.<String>get("county")),
                        criteria.getCounty().trim().toLowerCase(Locale.ROOT)));
            }
        }

        if (criteria.getCondition() != null) {
            predicates.add(cb.equal(root.get("condition"), criteria.getCondition()));
        }

        if (criteria.getIsPremium() != null) {
            if (criteria.getIsPremium()) {
                predicates.add(cb.notEqual(root.get("premiumType"), PremiumType.BASIC));
            } else {
                predicates.add(cb.equal(root.get("premiumType"), PremiumType.BASIC));
            }
        }
        if (criteria.getPremiumType() != null) {
            predicates.add(cb.equal(root.get("premiumType"), criteria.getPremiumType()));
        }

        if (hasText(criteria.getSellerId())) {
            predicates.add(cb.equal(root.get("sellerId"), criteria.getSellerId()));
        }

        if (hasText(criteria.getSearch())) {
            String pattern = "%" + escapeLike(criteria.getSearch().trim().toLowerCase(Locale.ROOT)) + "%";
            predicates.add(cb.or(
                    cb.like(cb.lower(root.<String>get("title")), pattern, LIKE_ESCAPE),
                    cb.like(cb.lower(root.<String>get("description")), pattern, LIKE_ESCAPE)
            ));
        }

        if (criteria.getCreatedAfter() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), criteria.getCreatedAfter()));
        }
        if (criteria.getCreatedBefore() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), criteria.getCreatedBefore()));
        }

        if (criteria.getIsNegotiable() != null) {
            predicates.add(cb.equal(root.get("isNegotiable"), criteria.getIsNegotiable()));
        }

        return predicates;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
