package com.chicu.marketbot.repository;

public enum PersistResult {
    /** Новый документ */
    INSERTED,
    /** Документ с тем же (item_id, timestamp) уже был: перезаписан */
    UPDATED,
    /** Все попытки исчерпаны, событие отброшено */
    FAILED;

    public boolean isStored() {
        return this != FAILED;
    }
}
