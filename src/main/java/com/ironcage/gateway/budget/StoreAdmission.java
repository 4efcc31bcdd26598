package com.ironcage.gateway.budget;

/**
 * A store's answer to a hold.
 *
 * @param spentMicros     committed spend as the store sees it
 * @param availableMicros what the store still had available when it refused; 0 when admitted
 */
public record StoreAdmission(boolean admitted, long spentMicros, long availableMicros) {

    public static StoreAdmission admitted(long spentMicros) {
        return new StoreAdmission(true, spentMicros, 0L);
    }

    public static StoreAdmission refused(long spentMicros, long availableMicros) {
        return new StoreAdmission(false, spentMicros, Math.max(0L, availableMicros));
    }
}
