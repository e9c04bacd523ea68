package com.leasehold.service.api;

import static com.leasehold.service.infrastructure.web.CorrelationIdFilter.CALLER_HEADER;

import com.leasehold.access.AccessRouter;
import com.leasehold.access.EntityRecord;
import com.leasehold.access.EntityRegistry;
import com.leasehold.access.vault.Vaults;
import com.leasehold.policy.engine.PolicyEngine;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entity API. The acting address comes from the {@code X-Leasehold-Caller} header, set by the
 * authenticating gateway in front of this service.
 */
@RestController
@RequestMapping("/api/v1/entities")
public class EntityController {

    private final AccessRouter router;
    private final EntityRegistry registry;
    private final PolicyEngine engine;
    private final Vaults vaults;
    private final Clock clock;

    public EntityController(AccessRouter router, EntityRegistry registry, PolicyEngine engine, Vaults vaults,
                            Clock clock) {
        this.router = router;
        this.registry = registry;
        this.engine = engine;
        this.vaults = vaults;
        this.clock = clock;
    }

    // ---- lease issuer ----

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Long> mint(@RequestHeader(CALLER_HEADER) String caller,
                                  @Valid @RequestBody MintRequest request) {
        return Map.of("id", registry.mint(caller, request.owner()));
    }

    @PutMapping("/{id}/lease")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void assignLease(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                            @Valid @RequestBody LeaseRequest request) {
        registry.assignLease(id, caller, request.renter(), request.expiry());
    }

    // ---- reads ----

    @GetMapping("/{id}")
    public EntityResponse get(@PathVariable long id) {
        EntityRecord record = registry.require(id);
        return EntityResponse.of(record, clock.instant(), vaults.require(id).balance(), engine.activePolicies(id));
    }

    // ---- actions ----

    @PostMapping("/{id}/actions")
    public ActionResponse execute(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                                  @Valid @RequestBody ActionRequest request) {
        return ActionResponse.from(router.execute(id, caller, request.toAction()));
    }

    @PostMapping("/{id}/actions/preview")
    public DecisionResponse preview(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                                    @Valid @RequestBody ActionRequest request) {
        return DecisionResponse.from(router.preview(id, caller, request.toAction()));
    }

    // ---- funds ----

    @PostMapping("/{id}/deposits")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deposit(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                        @Valid @RequestBody AmountRequest request) {
        vaults.require(id).deposit(caller, request.amount());
    }

    @PostMapping("/{id}/withdrawals")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void withdraw(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                         @Valid @RequestBody AmountRequest request) {
        router.withdraw(id, caller, request.amount());
    }

    // ---- operator delegation ----

    @PutMapping("/{id}/operator")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setOperator(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                            @Valid @RequestBody OperatorRequest request) {
        router.setOperator(id, caller, request.operator(), request.expiry());
    }

    @PostMapping("/{id}/operator/permit")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setOperatorWithPermit(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller,
                                      @Valid @RequestBody PermitRequest request) {
        router.setOperatorWithPermit(caller, request.toPermit(id), request.signatureBytes());
    }

    @DeleteMapping("/{id}/operator")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearOperator(@PathVariable long id, @RequestHeader(CALLER_HEADER) String caller) {
        router.clearOperator(id, caller);
    }
}
