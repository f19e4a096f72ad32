package com.keystone.tenantapi.domain;

import com.keystone.persistence.model.RoleDefinition;
import com.keystone.persistence.model.User;
import com.keystone.persistence.repository.RoleDefinitionRepository;
import com.keystone.persistence.repository.UserRepository;
import com.keystone.security.SystemRole;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Membership of the current tenant. Role names given to a user must be system roles other than
 * {@code super_admin}, or roles the tenant defines.
 */
@Service
public class UserService {

    private final UserRepository users;
    private final RoleDefinitionRepository roles;

    public UserService(UserRepository users, RoleDefinitionRepository roles) {
        this.users = users;
        this.roles = roles;
    }

    public List<User> list() {
        return users.findAll();
    }

    public Optional<User> find(String id) {
        return users.findById(id);
    }

    public User create(String email, String displayName, Set<String> roleNames) {
        Set<String> assigned = roleNames == null || roleNames.isEmpty()
                ? Set.of(SystemRole.USER.value())
                : roleNames;
        checkAssignable(assigned);
        return users.create(User.create(email, displayName, assigned));
    }

    /**
     * Applies the non-null changes.
     *
     * @throws com.keystone.persistence.OptimisticConflictException if {@code expectedVersion} is stale
     */
    public User update(String id, long expectedVersion, String displayName, Set<String> roleNames, Boolean active) {
        if (roleNames != null) {
            checkAssignable(roleNames);
        }
        return users.update(id, expectedVersion, user -> {
            User changed = user;
            if (displayName != null) {
                changed = changed.withDisplayName(displayName);
            }
            if (roleNames != null) {
                changed = changed.withRoleNames(roleNames);
            }
            if (active != null) {
                changed = changed.withActive(active);
            }
            return changed;
        });
    }

    public void delete(String id) {
        users.delete(id);
    }

    private void checkAssignable(Set<String> roleNames) {
        if (roleNames.contains(SystemRole.SUPER_ADMIN.value())) {
            throw new IllegalArgumentException("super_admin cannot be assigned within a tenant");
        }
        Set<String> unknown = new HashSet<>();
        for (String name : roleNames) {
            if (!SystemRole.isSystemRole(name)) {
                unknown.add(name);
            }
        }
        if (unknown.isEmpty()) {
            return;
        }
        for (RoleDefinition defined : roles.findByNames(unknown)) {
            unknown.remove(defined.name());
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown roles: " + unknown);
        }
    }
}
