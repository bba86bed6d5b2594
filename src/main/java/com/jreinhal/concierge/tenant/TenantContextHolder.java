package com.jreinhal.concierge.tenant;

/**
 * Request-scoped holder populated by the tenant filter. Services never read it; controllers
 * pass the resolved {@link TenantContext} explicitly.
 */
public final class TenantContextHolder {
    private static final ThreadLocal<TenantContext> current = new ThreadLocal<>();

    private TenantContextHolder() {
    }

    public static void set(TenantContext context) {
        if (context == null) {
            current.remove();
            return;
        }
        current.set(context);
    }

    public static TenantContext require() {
        TenantContext context = current.get();
        if (context == null) {
            throw new IllegalStateException("No tenant bound to the current request");
        }
        return context;
    }

    public static TenantContext getOrNull() {
        return current.get();
    }

    public static void clear() {
        current.remove();
    }
}
