package io.hearthwarrio.mobitium.core.locator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Platform-scoped element descriptor.
 * <p>
 * For each platform a locator holds either one {@link Query} or an ordered list of alternatives that are tried in
 * declaration order. A platform without any configured query resolves to {@code null} ("no query"): that is not an
 * error here, callers decide what it means.
 * <p>
 * The platform is passed in at resolution time rather than captured at construction, so one constant locator can be
 * shared by Android and iOS tests. Treat the session platform as fixed for the whole run.
 * <p>
 * Instances are immutable.
 */
public final class Locator {

    private final Query android;
    private final Query ios;
    private final List<Query> androidList;
    private final List<Query> iosList;

    private Locator(Query android, Query ios, List<Query> androidList, List<Query> iosList) {
        this.android = android;
        this.ios = ios;
        this.androidList = immutableOrNull(androidList);
        this.iosList = immutableOrNull(iosList);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Same query on both platforms.
     */
    public static Locator of(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        return new Locator(query, query, null, null);
    }

    /**
     * Separate queries per platform; either may be {@code null}.
     */
    public static Locator of(Query android, Query ios) {
        return new Locator(android, ios, null, null);
    }

    public static Locator byAccessibilityId(String accessibilityId) {
        return of(Queries.accessibilityId(accessibilityId));
    }

    public static Locator byAndroidAccessibilityId(String accessibilityId) {
        return of(Queries.accessibilityId(accessibilityId), null);
    }

    public static Locator byIosAccessibilityId(String accessibilityId) {
        return of(null, Queries.accessibilityId(accessibilityId));
    }

    public static Locator byAndroidUiAutomator(String expression) {
        return of(Queries.androidUiAutomator(expression), null);
    }

    public static Locator byIosClassChain(String expression) {
        return of(null, Queries.iosClassChain(expression));
    }

    public static Locator byIosPredicateString(String expression) {
        return of(null, Queries.iosPredicateString(expression));
    }

    public static Locator byAndroidLocators(List<Query> queries) {
        return new Locator(null, null, queries, null);
    }

    public static Locator byIosLocators(List<Query> queries) {
        return new Locator(null, null, null, queries);
    }

    public static Locator byLocators(List<Query> androidQueries, List<Query> iosQueries) {
        return new Locator(null, null, androidQueries, iosQueries);
    }

    /**
     * Returns the single query for the given platform.
     * <p>
     * Falls back to the first alternative when only a list was configured.
     *
     * @param platform active platform
     * @return query, or {@code null} when the platform has none
     */
    public Query get(Platform platform) {
        Objects.requireNonNull(platform, "platform must not be null");
        Query single = platform == Platform.ANDROID ? android : ios;
        if (single != null) {
            return single;
        }
        List<Query> list = platform == Platform.ANDROID ? androidList : iosList;
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /**
     * Returns every configured alternative for the given platform in declaration order.
     *
     * @param platform active platform
     * @return alternatives, or {@code null} when the platform has none
     */
    public List<Query> getAll(Platform platform) {
        Objects.requireNonNull(platform, "platform must not be null");
        List<Query> list = platform == Platform.ANDROID ? androidList : iosList;
        if (list != null) {
            return list;
        }
        Query single = platform == Platform.ANDROID ? android : ios;
        return single == null ? null : Collections.singletonList(single);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Locator{");
        sb.append("android=").append(androidList != null ? androidList : android);
        sb.append(", ios=").append(iosList != null ? iosList : ios);
        return sb.append('}').toString();
    }

    private static List<Query> immutableOrNull(List<Query> queries) {
        if (queries == null) {
            return null;
        }
        List<Query> copy = new ArrayList<>(queries.size());
        for (Query q : queries) {
            copy.add(Objects.requireNonNull(q, "queries must not contain null"));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Builder for mixed single/list forms.
     */
    public static final class Builder {
        private Query android;
        private Query ios;
        private List<Query> androidList;
        private List<Query> iosList;

        private Builder() {
        }

        public Builder android(Query query) {
            this.android = query;
            return this;
        }

        public Builder ios(Query query) {
            this.ios = query;
            return this;
        }

        public Builder androidAlternatives(Query... queries) {
            this.androidList = queries == null ? null : List.of(queries);
            return this;
        }

        public Builder iosAlternatives(Query... queries) {
            this.iosList = queries == null ? null : List.of(queries);
            return this;
        }

        public Locator build() {
            return new Locator(android, ios, androidList, iosList);
        }
    }
}
