package warden.core.model.decision;

import java.util.Objects;

import warden.core.model.behavior.BehaviorEvent;
import warden.core.model.identity.ClientIdentity;

/**
 * Input of a security decision.
 *
 * @param identity      resolved client identity
 * @param clientIp      client address, used for reputation lookups
 * @param path          request path, classified into an endpoint class
 * @param credentialKey credential targeted by the request (login endpoints), may be null
 * @param event         behavior event for an authenticated action, may be null
 * @param sessionToken  session of the request, may be null
 */
public record DecisionRequest(
        ClientIdentity identity,
        String clientIp,
        String path,
        String credentialKey,
        BehaviorEvent event,
        String sessionToken) {

    public DecisionRequest {
        Objects.requireNonNull(identity, "identity cannot be null");
        path = path != null ? path : "/";
    }
}
