package io.jsoninject.standalone.procedure;

/**
 * A named, trusted routine that builds JSON for the {@code procedure} source. A page definition
 * names the procedure in its {@code procedure} field; the routine writes exactly one JSON value to
 * {@link ProcedureContext#out()}.
 */
@FunctionalInterface
public interface Procedure {

    /**
     * Writes the payload.
     *
     * @throws Exception any failure; reported as a code execution error
     */
    void run(ProcedureContext context) throws Exception;
}
