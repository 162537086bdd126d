package io.jsoninject.standalone.procedure;

import java.util.Map;

/**
 * Service-provider interface for contributing procedures. Implementations are discovered with
 * {@link java.util.ServiceLoader} from {@code META-INF/services/}{@code
 * io.jsoninject.standalone.procedure.ProcedureProvider}.
 */
public interface ProcedureProvider {

    /** Procedures by name. Names are matched case-insensitively. */
    Map<String, Procedure> procedures();
}
