package com.keystone.persistence.repository;

import com.keystone.persistence.Criteria;
import com.keystone.persistence.DataOperation;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.TenantScopedGateway;
import com.keystone.persistence.model.RoleDefinition;
import com.keystone.security.Permission;
import com.keystone.security.SystemRole;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Roles defined by the current tenant. */
public class RoleDefinitionRepository {

    private final TenantScopedGateway gateway;

    public RoleDefinitionRepository(TenantScopedGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @throws IllegalArgumentException if the name is a system role name
     * @throws DuplicateRecordException if the tenant already defines a role with that name
     */
    public RoleDefinition create(RoleDefinition role) {
        if (SystemRole.isSystemRole(role.name())) {
            throw new IllegalArgumentException("'%s' is a system role name".formatted(role.name()));
        }
        return gateway.execute(DataOperation.create(RoleDefinition.class, role).unique("name", RoleDefinition::name));
    }

    public Optional<RoleDefinition> findById(String id) {
        return gateway.execute(DataOperation.findById(RoleDefinition.class, id));
    }

    public Optional<RoleDefinition> findByName(String name) {
        Criteria<RoleDefinition> byName = Criteria.where("name", RoleDefinition::name, name);
        return gateway.execute(DataOperation.findMany(RoleDefinition.class, byName)).stream().findFirst();
    }

    /** Roles of the tenant whose name is in {@code names}; unknown names are ignored. */
    public List<RoleDefinition> findByNames(Set<String> names) {
        return findAll().stream().filter(role -> names.contains(role.name())).toList();
    }

    public List<RoleDefinition> findAll() {
        return gateway.execute(DataOperation.findMany(RoleDefinition.class, Criteria.all()));
    }

    public RoleDefinition updatePermissions(String id, long expectedVersion, Set<Permission> permissions) {
        return gateway.execute(DataOperation.update(RoleDefinition.class, id, expectedVersion,
                role -> role.withPermissions(permissions)));
    }

    /**
     * @throws RecordNotFoundException if the tenant has no live role with that id
     */
    public void delete(String id) {
        if (!gateway.execute(DataOperation.delete(RoleDefinition.class, id))) {
            throw new RecordNotFoundException("RoleDefinition", id);
        }
    }
}
