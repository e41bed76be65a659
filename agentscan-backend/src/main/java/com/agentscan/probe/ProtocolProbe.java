package com.agentscan.probe;

import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ScanTarget;

/**
 * Network probe for one protocol. Implementations live outside this module and are picked up as beans.
 *
 * <p>Implementations may block and may throw; {@link ProbeRunner} bounds them with a deadline and
 * turns any failure into a {@code not_detected}, low-confidence result.
 */
public interface ProtocolProbe {

    Protocol protocol();

    ProbeResult probe(ScanTarget target) throws Exception;
}
