package org.m2mrsp.dropwizard;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import org.m2mrsp.dropwizard.health.EntityCertificateHealthCheck;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.crypto.Ecdh;
import org.m2mrsp.protocol.crypto.PskCipher;
import org.m2mrsp.protocol.identity.CertificateAuthority;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.EntityIdentity;
import org.m2mrsp.protocol.identity.TrustAnchorCertificateVerifier;
import org.m2mrsp.protocol.isdp.IsdpLifecycleManager;
import org.m2mrsp.protocol.profile.ProfileCodec;
import org.m2mrsp.server.entity.Euicc;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.m2mrsp.server.entity.SmDp;
import org.m2mrsp.server.entity.SmSr;
import org.m2mrsp.server.metrics.DropwizardMetricsRecorder;
import org.m2mrsp.server.metrics.MetricsRecorder;
import org.m2mrsp.server.orchestrator.ProvisioningOrchestrator;
import org.m2mrsp.server.resource.EuiccResource;
import org.m2mrsp.server.resource.ProvisioningResource;
import org.m2mrsp.server.resource.RspExceptionMapper;
import org.m2mrsp.server.resource.SmDpResource;
import org.m2mrsp.server.resource.SmSrResource;
import org.m2mrsp.server.resource.WebApplicationExceptionMapper;
import org.m2mrsp.server.store.InMemoryPskStore;
import org.m2mrsp.server.store.InMemorySessionStore;
import org.m2mrsp.server.store.PskStore;
import org.m2mrsp.server.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires SM-DP, SM-SR and the configured simulated eUICCs into an
 * existing Dropwizard application.
 * <p>
 * Registers the SM-DP, SM-SR, eUICC and provisioning resources, the protocol exception mapper
 * and one certificate health check per server entity. Requires a {@link RspConfiguration}.
 * <p>
 * Embed with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new RspBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new RspBundle<>(smDpSessions, rekeySessions, pskStore));
 * }</pre>
 */
@Singleton
public class RspBundle<C extends RspConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(RspBundle.class);

  private final SessionStore smDpSessions;
  private final SessionStore rekeySessions;
  private final PskStore pskStore;
  private final EuiccDirectory euiccs = new EuiccDirectory();

  /**
   * Creates a bundle backed by in-memory stores. Session stores are built in {@link #run} so
   * that they pick up the configured TTL.
   */
  public RspBundle() {
    this.smDpSessions = null;
    this.rekeySessions = null;
    this.pskStore = new InMemoryPskStore();
    log.warn("""
        #################################################################
        # WARNING: Using in-memory session and PSK stores and an        #
        # ephemeral root CA. All keys are lost on restart.              #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  @Inject
  public RspBundle(SessionStore smDpSessions, SessionStore rekeySessions, PskStore pskStore) {
    this.smDpSessions = smDpSessions;
    this.rekeySessions = rekeySessions;
    this.pskStore = pskStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider randomProvider = new RandomProvider();
    Clock clock = Clock.systemUTC();
    CertificateAuthority rootCa = CertificateAuthority.create(configuration.getRootCaName());
    CertificateVerifier verifier = new TrustAnchorCertificateVerifier(rootCa);
    EntityIdentity smDpIdentity = EntityIdentity.issuedBy(configuration.getSmDpName(), rootCa);
    EntityIdentity smSrIdentity = EntityIdentity.issuedBy(configuration.getSmSrName(), rootCa);

    Ecdh ecdh = new Ecdh(randomProvider);
    PskCipher pskCipher = new PskCipher(configuration.getPbkdf2Iterations(), randomProvider,
        new ObjectMapper());
    MetricsRecorder metrics = new DropwizardMetricsRecorder(environment.metrics());
    Duration sessionTtl = Duration.ofSeconds(configuration.getSessionTtlSeconds());

    SmDp smDp = new SmDp(smDpIdentity, verifier, ecdh,
        sessionStore(smDpSessions, sessionTtl, clock, environment), new ProfileCodec(),
        randomProvider, clock, configuration.getSegmentSize());
    SmSr smSr = new SmSr(smSrIdentity, verifier, new IsdpLifecycleManager(randomProvider, clock),
        pskStore, pskCipher, ecdh, sessionStore(rekeySessions, sessionTtl, clock, environment),
        randomProvider, clock, metrics, configuration.getRegistrationPskLength());
    ProvisioningOrchestrator orchestrator = new ProvisioningOrchestrator(smDp, smSr, metrics);

    for (EuiccConfiguration card : configuration.getEuiccs()) {
      Euicc euicc = new Euicc(card.getEuiccId(), EntityIdentity.issuedBy(card.getEuiccId(), rootCa),
          verifier, ecdh, pskCipher, new ProfileCodec(), card.getFreeMemory(), clock);
      euiccs.add(euicc);
      orchestrator.register(euicc);
    }
    log.info("Attached {} eUICC(s) under root CA {}", configuration.getEuiccs().size(),
        rootCa.getName());

    environment.jersey().register(new SmDpResource(smDp));
    environment.jersey().register(new SmSrResource(smSr, euiccs, orchestrator));
    environment.jersey().register(new EuiccResource(euiccs));
    environment.jersey().register(new ProvisioningResource(orchestrator, euiccs));
    environment.jersey().register(new RspExceptionMapper());
    environment.jersey().register(new WebApplicationExceptionMapper());
    environment.healthChecks().register("sm-dp",
        new EntityCertificateHealthCheck(smDpIdentity, verifier));
    environment.healthChecks().register("sm-sr",
        new EntityCertificateHealthCheck(smSrIdentity, verifier));
  }

  /**
   * The attached simulated cards.
   */
  public EuiccDirectory getEuiccs() {
    return euiccs;
  }

  private static SessionStore sessionStore(SessionStore supplied, Duration ttl, Clock clock,
                                           Environment environment) {
    if (supplied != null) {
      return supplied;
    }
    InMemorySessionStore store = new InMemorySessionStore(ttl, clock, true);
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // reaper is started by the constructor
      }

      @Override
      public void stop() {
        store.shutdown();
      }
    });
    return store;
  }
}
