package com.vlrnotify.domain.model;

/**
 * Outcome of merging one polled event into the store.
 */
public final class UpsertResult {

    public enum Type {
        INSERTED,
        UPDATED
    }

    private static final UpsertResult INSERTED = new UpsertResult(Type.INSERTED, true);
    private static final UpsertResult CHANGED = new UpsertResult(Type.UPDATED, true);
    private static final UpsertResult UNCHANGED = new UpsertResult(Type.UPDATED, false);

    private final Type type;
    private final boolean changed;

    private UpsertResult(Type type, boolean changed) {
        this.type = type;
        this.changed = changed;
    }

    public static UpsertResult inserted() {
        return INSERTED;
    }

    public static UpsertResult updated(boolean changed) {
        return changed ? CHANGED : UNCHANGED;
    }

    public Type getType() {
        return type;
    }

    public boolean isInserted() {
        return type == Type.INSERTED;
    }

    /**
     * For updates, whether any polled field differed from the stored record.
     */
    public boolean isChanged() {
        return changed;
    }

    @Override
    public String toString() {
        return type == Type.INSERTED ? "Inserted" : "Updated(changed=" + changed + ")";
    }
}
