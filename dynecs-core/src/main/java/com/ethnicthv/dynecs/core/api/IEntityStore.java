package com.ethnicthv.dynecs.core.api;

import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.Entity;
import com.ethnicthv.dynecs.core.field.FieldType;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Public API of the entity-component store.
 * <p>
 * Entities are bare ids. Components are named bags of numeric fields attached at runtime; any
 * string is a valid component or field name and any id is a valid lookup key. Unknown keys yield
 * "not found" outcomes (false, empty, {@link FieldStatus}) rather than exceptions.
 */
public interface IEntityStore {

    /**
     * Create a new entity carrying the given components.
     *
     * @param initialComponents component name -> component; may be empty
     * @return the new entity id; ids start at 1 and strictly increase
     */
    long addEntity(Map<String, Component> initialComponents);

    /**
     * Attach a component to an entity unless one with the same name is already attached.
     * The id does not have to come from {@link #addEntity}.
     *
     * @return true if the component was stored, false if the existing one was kept
     */
    boolean attachComponent(long entityId, String componentName, Component component);

    /**
     * Build a view of all components attached to the entity. Unknown ids give an empty view.
     */
    Entity getEntity(long entityId);

    /**
     * All created entities carrying every named component. An empty name list returns all
     * created entities; a name that was never registered returns none.
     */
    List<Entity> getEntitiesWithComponents(List<String> componentNames);

    default List<Entity> getEntitiesWithComponents(String... componentNames) {
        return getEntitiesWithComponents(Arrays.asList(componentNames));
    }

    /**
     * Entities carrying all of {@code with} and none of {@code without}.
     */
    List<Entity> findEntities(Collection<String> with, Collection<String> without);

    /**
     * Ids of entities carrying all of {@code with} and none of {@code without}.
     */
    List<Long> findEntityIds(Collection<String> with, Collection<String> without);

    /**
     * Insert or overwrite a field inside an attached component.
     *
     * @return false, with no side effect, if the entity has no component under that name
     */
    boolean updateField(long entityId, String componentName, String fieldName, FieldType value);

    Optional<FieldType> getField(long entityId, String componentName, String fieldName);

    /**
     * Add {@code delta} to an existing field using {@link com.ethnicthv.dynecs.core.field.FieldArithmetic}.
     *
     * @return false, with no side effect, if the field is not set
     */
    boolean incrementField(long entityId, String componentName, String fieldName, FieldType delta);

    /**
     * Resolve why a field is or is not readable.
     */
    FieldStatus fieldStatus(long entityId, String componentName, String fieldName);

    boolean hasComponent(long entityId, String componentName);

    /**
     * Snapshot of every id issued by {@link #addEntity}, in creation order.
     */
    List<Long> getEntityIds();

    int getEntityCount();

    /**
     * Names of all component categories ever registered.
     */
    Set<String> getComponentNames();

    /**
     * Create a query for filtering entities based on component requirements.
     */
    IEntityQuery query();
}
