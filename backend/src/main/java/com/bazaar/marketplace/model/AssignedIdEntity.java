package com.bazaar.marketplace.model;

import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

/**
 * Base for entities whose id is assigned by the application. Saving a fresh instance
 * always issues an INSERT, so a duplicate key surfaces as a constraint violation
 * instead of a silent merge.
 */
@MappedSuperclass
public abstract class AssignedIdEntity implements Persistable<String> {

    @Transient
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    public void markPersisted() {
        newRecord = false;
    }

    protected void copyStateTo(AssignedIdEntity target) {
        target.newRecord = newRecord;
    }
}
