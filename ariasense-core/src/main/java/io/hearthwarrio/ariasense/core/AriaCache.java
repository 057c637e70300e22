package io.hearthwarrio.ariasense.core;

import io.hearthwarrio.ariasense.core.dom.DomElement;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Pass-scoped memoization for role, hidden-state and accessible name lookups.
 * <p>
 * The cache is reference counted: {@link #begin()} opens a pass, {@link #end()} closes it. Nested passes share the
 * same maps; when the last pass closes, everything is dropped, so nothing survives between two disjoint passes.
 * While no pass is open, lookups are not memoized at all.
 * <p>
 * One instance per document snapshot. Not thread-safe.
 */
public final class AriaCache {

    private int openPasses;

    private Map<DomElement, String> names;
    private Map<DomElement, String> namesIncludingHidden;
    private Map<DomElement, Boolean> hidden;
    private Map<DomElement, Holder> roles;

    /**
     * Role lookups may legitimately yield null, so they are wrapped.
     */
    static final class Holder {
        final AriaRole role;

        Holder(AriaRole role) {
            this.role = role;
        }
    }

    /**
     * Opens a pass. Maps are created on the first open pass and reused by nested ones.
     */
    public void begin() {
        ++openPasses;
        if (names == null) {
            names = new IdentityHashMap<>();
            namesIncludingHidden = new IdentityHashMap<>();
            hidden = new IdentityHashMap<>();
            roles = new IdentityHashMap<>();
        }
    }

    /**
     * Closes a pass. The last close drops all cached values.
     *
     * @throws IllegalStateException when no pass is open
     */
    public void end() {
        if (openPasses == 0) {
            throw new IllegalStateException("AriaCache.end() called without a matching begin()");
        }
        if (--openPasses == 0) {
            names = null;
            namesIncludingHidden = null;
            hidden = null;
            roles = null;
        }
    }

    /**
     * Opens a pass for use with try-with-resources.
     *
     * @return pass handle; closing it calls {@link #end()}
     */
    public Pass open() {
        begin();
        return new Pass(this);
    }

    public boolean isOpen() {
        return openPasses > 0;
    }

    int openPassCount() {
        return openPasses;
    }

    String getName(DomElement element, boolean includeHidden) {
        Map<DomElement, String> m = includeHidden ? namesIncludingHidden : names;
        return m == null ? null : m.get(element);
    }

    void putName(DomElement element, boolean includeHidden, String name) {
        Map<DomElement, String> m = includeHidden ? namesIncludingHidden : names;
        if (m != null) {
            m.put(element, name);
        }
    }

    Boolean getHidden(DomElement element) {
        return hidden == null ? null : hidden.get(element);
    }

    void putHidden(DomElement element, boolean value) {
        if (hidden != null) {
            hidden.put(element, value);
        }
    }

    Holder getRole(DomElement element) {
        return roles == null ? null : roles.get(element);
    }

    void putRole(DomElement element, AriaRole role) {
        if (roles != null) {
            roles.put(element, new Holder(role));
        }
    }

    /**
     * Handle of one open pass.
     */
    public static final class Pass implements AutoCloseable {

        private final AriaCache cache;
        private boolean closed;

        private Pass(AriaCache cache) {
            this.cache = cache;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            cache.end();
        }
    }
}
