package com.coshare.api.account;

import com.coshare.application.service.AllowListManager;
import com.coshare.application.service.AuthorityRedeemer;
import com.coshare.application.service.CredentialIssuer;
import com.coshare.application.service.SharedAccountFactory;
import com.coshare.application.service.SharedAccountQueries;
import com.coshare.domain.identity.IdentityId;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the shared-account protocol.
 *
 * The calling principal comes from {@code X-Principal}; the gateway in front of this
 * service is responsible for authenticating it.
 */
@RestController
@RequestMapping("/api/v1")
public class SharedAccountController {

  public static final String HDR_PRINCIPAL = "X-Principal";

  private final SharedAccountFactory factory;
  private final AllowListManager allowList;
  private final CredentialIssuer issuer;
  private final AuthorityRedeemer redeemer;
  private final SharedAccountQueries queries;

  public SharedAccountController(SharedAccountFactory factory,
                                 AllowListManager allowList,
                                 CredentialIssuer issuer,
                                 AuthorityRedeemer redeemer,
                                 SharedAccountQueries queries) {
    this.factory = factory;
    this.allowList = allowList;
    this.issuer = issuer;
    this.redeemer = redeemer;
    this.queries = queries;
  }

  @PostMapping("/accounts")
  public ResponseEntity<Map<String, Object>> create(
      @RequestHeader(HDR_PRINCIPAL) String principal,
      @Valid @RequestBody CreateAccountRequest req
  ) {
    IdentityId creator = IdentityId.parse(principal);
    IdentityId target = factory.createSharedAccount(creator, SeedCodec.decode(req.seed()));

    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
        "status", "ok",
        "target", target.value(),
        "admin", creator.value(),
        "ts", Instant.now().toString()
    ));
  }

  @GetMapping("/accounts/{target}")
  public ResponseEntity<Map<String, Object>> view(@PathVariable("target") String target) {
    IdentityId id = IdentityId.parse(target);
    IdentityId admin = queries.admin(id);
    List<String> unclaimed = queries.unclaimed(id).stream().map(IdentityId::value).toList();

    return ResponseEntity.ok(Map.of(
        "target", id.value(),
        "admin", admin.value(),
        "unclaimed", unclaimed,
        "ts", Instant.now().toString()
    ));
  }

  @PostMapping("/accounts/{target}/claimers")
  public ResponseEntity<Map<String, Object>> addClaimer(
      @RequestHeader(HDR_PRINCIPAL) String principal,
      @PathVariable("target") String target,
      @Valid @RequestBody AddClaimerRequest req
  ) {
    IdentityId claimer = IdentityId.parse(req.claimer());
    allowList.addClaimer(IdentityId.parse(principal), IdentityId.parse(target), claimer);

    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "action", "ALLOW_ADD",
        "claimer", claimer.value(),
        "ts", Instant.now().toString()
    ));
  }

  @DeleteMapping("/accounts/{target}/claimers/{claimer}")
  public ResponseEntity<Map<String, Object>> removeClaimer(
      @RequestHeader(HDR_PRINCIPAL) String principal,
      @PathVariable("target") String target,
      @PathVariable("claimer") String claimer
  ) {
    IdentityId claimerId = IdentityId.parse(claimer);
    allowList.removeClaimer(IdentityId.parse(principal), IdentityId.parse(target), claimerId);

    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "action", "ALLOW_REMOVE",
        "claimer", claimerId.value(),
        "ts", Instant.now().toString()
    ));
  }

  @PostMapping("/accounts/{target}/capability")
  public ResponseEntity<Map<String, Object>> claim(
      @RequestHeader(HDR_PRINCIPAL) String principal,
      @PathVariable("target") String target
  ) {
    IdentityId claimer = IdentityId.parse(principal);
    IdentityId targetId = IdentityId.parse(target);
    issuer.claimCapability(claimer, targetId);

    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "action", "CLAIM",
        "holder", claimer.value(),
        "target", targetId.value(),
        "ts", Instant.now().toString()
    ));
  }

  @PostMapping("/accounts/{target}/authority")
  public ResponseEntity<Map<String, Object>> acquire(
      @RequestHeader(HDR_PRINCIPAL) String principal,
      @PathVariable("target") String target
  ) {
    IdentityId acquirer = IdentityId.parse(principal);
    IdentityId targetId = IdentityId.parse(target);

    IdentityId actingAs = redeemer.acquireAuthority(acquirer, targetId, authority -> {
      authority.checkActingAs(targetId);
      return authority.identity();
    });

    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "action", "REDEEM",
        "actingAs", actingAs.value(),
        "redeemedBy", acquirer.value(),
        "ts", Instant.now().toString()
    ));
  }

  @GetMapping("/principals/{principal}/capability")
  public ResponseEntity<Map<String, Object>> heldCapability(@PathVariable("principal") String principal) {
    IdentityId id = IdentityId.parse(principal);
    return ResponseEntity.ok(queries.heldCapability(id)
        .<Map<String, Object>>map(t -> Map.of("principal", id.value(), "holding", true, "target", t.value()))
        .orElseGet(() -> Map.of("principal", id.value(), "holding", false)));
  }
}
