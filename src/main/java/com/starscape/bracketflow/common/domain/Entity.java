package com.starscape.bracketflow.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base for identity-compared domain entities. Equality is by id once assigned;
 * the hash is stable across the entity's lifecycle.
 */
public abstract class Entity<ID extends Serializable> {
    
    protected Entity() {
    }
    
    protected Entity(ID id) {
        Objects.requireNonNull(id, "id");
    }
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
