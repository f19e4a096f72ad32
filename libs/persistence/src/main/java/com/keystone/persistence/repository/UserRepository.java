package com.keystone.persistence.repository;

import com.keystone.persistence.AggregateFunction;
import com.keystone.persistence.Criteria;
import com.keystone.persistence.DataOperation;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.TenantScopedGateway;
import com.keystone.persistence.model.User;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Users of the current tenant. Every operation is scoped by the gateway; this class never names a
 * tenant itself.
 */
public class UserRepository {

    private final TenantScopedGateway gateway;

    public UserRepository(TenantScopedGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @throws DuplicateRecordException if a live user of the tenant already has the email
     */
    public User create(User user) {
        return gateway.execute(DataOperation.create(User.class, user).unique("email", User::email));
    }

    public Optional<User> findById(String id) {
        return gateway.execute(DataOperation.findById(User.class, id));
    }

    /** Also returns a soft-deleted user. */
    public Optional<User> findByIdIncludingDeleted(String id) {
        return gateway.execute(DataOperation.findById(User.class, id).includeDeleted());
    }

    public Optional<User> findByEmail(String email) {
        Criteria<User> byEmail = Criteria.where("email", User::email, email.strip().toLowerCase(Locale.ROOT));
        return gateway.execute(DataOperation.findMany(User.class, byEmail)).stream().findFirst();
    }

    public List<User> findAll() {
        return gateway.execute(DataOperation.findMany(User.class, Criteria.all()));
    }

    public List<User> findByActive(boolean active) {
        Criteria<User> byActive = Criteria.where("active", User::active, active);
        return gateway.execute(DataOperation.findMany(User.class, byActive));
    }

    public long count() {
        return gateway.execute(DataOperation.count(User.class, Criteria.all()));
    }

    /** Creation time of the tenant's newest user, if it has any. */
    public Optional<Instant> lastCreatedAt() {
        var latest = gateway.execute(DataOperation.aggregate(User.class, Criteria.all(), AggregateFunction.MAX,
                u -> u.meta().createdAt().toEpochMilli()));
        return latest.isPresent() ? Optional.of(Instant.ofEpochMilli((long) latest.getAsDouble())) : Optional.empty();
    }

    /**
     * @throws com.keystone.persistence.OptimisticConflictException if {@code expectedVersion} is stale
     * @throws RecordNotFoundException if no live user of the tenant has that id
     */
    public User update(String id, long expectedVersion, UnaryOperator<User> change) {
        return gateway.execute(DataOperation.update(User.class, id, expectedVersion, change));
    }

    /**
     * @throws RecordNotFoundException if no live user of the tenant has that id
     */
    public void delete(String id) {
        if (!gateway.execute(DataOperation.delete(User.class, id))) {
            throw new RecordNotFoundException("User", id);
        }
    }
}
