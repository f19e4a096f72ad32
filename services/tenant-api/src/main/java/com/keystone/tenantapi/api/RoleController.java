package com.keystone.tenantapi.api;

import com.keystone.audit.AuditAction;
import com.keystone.persistence.model.RoleDefinition;
import com.keystone.persistence.repository.RoleDefinitionRepository;
import com.keystone.security.Permission;
import com.keystone.tenantapi.api.dto.CreateRoleRequest;
import com.keystone.tenantapi.api.dto.RoleResponse;
import com.keystone.tenantapi.security.Audited;
import com.keystone.tenantapi.security.RequiresPermissions;
import jakarta.validation.Valid;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Roles defined by the caller's tenant. */
@RestController
@RequestMapping("/api/v1/roles")
public class RoleController {

    private final RoleDefinitionRepository roles;

    public RoleController(RoleDefinitionRepository roles) {
        this.roles = roles;
    }

    @RequiresPermissions("roles:read")
    @GetMapping
    public List<RoleResponse> list() {
        return roles.findAll().stream().map(RoleResponse::from).toList();
    }

    @RequiresPermissions("roles:create")
    @Audited(action = AuditAction.CREATE, resource = "Role")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RoleResponse create(@Valid @RequestBody CreateRoleRequest request) {
        Set<Permission> permissions = new LinkedHashSet<>();
        for (String permission : request.permissions()) {
            permissions.add(Permission.parse(permission));
        }
        RoleDefinition created = roles.create(RoleDefinition.create(request.name(), request.description(), permissions));
        return RoleResponse.from(created);
    }
}
