package com.baykanat.cardflow.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Kimlik katmanından gelen, önceden doğrulanmış istek bağlamı.
 *
 * <p>Her engine/scheduler/bundler çağrısına ilk parametre olarak açıkça geçirilir; thread-local yok.
 */
@Value
public class AccessContext {

    public static final String SYSTEM_ACTOR_ID = "system";

    @NonNull
    String tenantId;
    @NonNull
    String actorId;
    @NonNull
    Role role;

    public static AccessContext system(String tenantId) {
        return new AccessContext(tenantId, SYSTEM_ACTOR_ID, Role.SYSTEM);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN || role == Role.SYSTEM;
    }
}
