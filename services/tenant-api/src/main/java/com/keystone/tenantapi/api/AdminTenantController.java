package com.keystone.tenantapi.api;

import com.keystone.audit.AuditAction;
import com.keystone.persistence.repository.TenantRepository;
import com.keystone.tenantapi.api.dto.CreateTenantRequest;
import com.keystone.tenantapi.api.dto.TenantResponse;
import com.keystone.tenantapi.domain.TenantProvisioningService;
import com.keystone.tenantapi.domain.TenantProvisioningService.ProvisionedTenant;
import com.keystone.tenantapi.security.Audited;
import com.keystone.tenantapi.security.RequiresRoles;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Platform administration of tenants. Super administrators only. */
@RestController
@RequestMapping("/api/v1/admin/tenants")
@RequiresRoles("super_admin")
public class AdminTenantController {

    private final TenantProvisioningService provisioning;
    private final TenantRepository tenants;

    public AdminTenantController(TenantProvisioningService provisioning, TenantRepository tenants) {
        this.provisioning = provisioning;
        this.tenants = tenants;
    }

    @GetMapping
    public List<TenantResponse> list() {
        return tenants.findAll().stream().map(tenant -> TenantResponse.from(tenant, null)).toList();
    }

    @Audited(action = AuditAction.CREATE, resource = "Tenant")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse create(@Valid @RequestBody CreateTenantRequest request) {
        ProvisionedTenant provisioned =
                provisioning.provision(request.slug(), request.name(), request.adminEmail(), request.adminName());
        return TenantResponse.from(provisioned.tenant(), provisioned.administrator().id());
    }
}
