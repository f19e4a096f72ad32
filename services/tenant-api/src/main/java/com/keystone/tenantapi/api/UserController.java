package com.keystone.tenantapi.api;

import com.keystone.audit.AuditAction;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.tenantapi.api.dto.CreateUserRequest;
import com.keystone.tenantapi.api.dto.UpdateUserRequest;
import com.keystone.tenantapi.api.dto.UserResponse;
import com.keystone.tenantapi.domain.UserService;
import com.keystone.tenantapi.security.Audited;
import com.keystone.tenantapi.security.RequiresPermissions;
import com.keystone.tenantapi.security.RequiresRoles;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Users of the caller's tenant. */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService users;

    public UserController(UserService users) {
        this.users = users;
    }

    @RequiresPermissions("users:read")
    @GetMapping
    public List<UserResponse> list() {
        return users.list().stream().map(UserResponse::from).toList();
    }

    @RequiresPermissions("users:read")
    @GetMapping("/{id}")
    public UserResponse get(@PathVariable String id) {
        return users.find(id).map(UserResponse::from).orElseThrow(() -> new RecordNotFoundException("User", id));
    }

    @RequiresPermissions("users:create")
    @Audited(action = AuditAction.CREATE, resource = "User")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse create(@Valid @RequestBody CreateUserRequest request) {
        return UserResponse.from(users.create(request.email(), request.displayName(), request.roles()));
    }

    @RequiresPermissions("users:update")
    @Audited(action = AuditAction.UPDATE, resource = "User")
    @PutMapping("/{id}")
    public UserResponse update(@PathVariable String id, @Valid @RequestBody UpdateUserRequest request) {
        return UserResponse.from(users.update(id, request.version(), request.displayName(), request.roles(),
                request.active()));
    }

    @RequiresRoles("admin")
    @RequiresPermissions("users:delete")
    @Audited(action = AuditAction.DELETE, resource = "User")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        users.delete(id);
    }
}
