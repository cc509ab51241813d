package projectelastic.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.boundary.DisplacementConstraint;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.geometry.Line;
import projectelastic.domain.load.Load;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.SectionProperties;
import projectelastic.domain.solution.Solution;
import projectelastic.factory.LinearSolverFactory;
import projectelastic.physics.boundary.BoundaryConsolidator;
import projectelastic.physics.boundary.NodalBoundaryTable;
import projectelastic.physics.i.ILinearSolver;
import projectelastic.physics.post.StressRecovery;
import projectelastic.physics.solver.GlobalSystem;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Orquesta un cálculo estático lineal completo.
 * Facade de alto nivel sobre {@link BoundaryConsolidator}, {@link GlobalSystem} y {@link StressRecovery}.
 * <p>
 * Cada llamada a {@link #solve} crea una sesión nueva; la última solución se conserva en
 * {@link #getLastSolution()} y solo se sustituye si el nuevo cálculo termina sin errores.
 */
@Slf4j
public class LinearStaticAnalysis {

    private final SolverConfig config;
    private final BoundaryConsolidator consolidator;
    private final BiFunction<SolverConfig, Boolean, ILinearSolver> solverProvider;

    @Getter
    private Solution lastSolution;

    public LinearStaticAnalysis(SolverConfig config) {
        this(config, LinearSolverFactory::create);
    }

    /**
     * Permite inyectar la estrategia de resolución (p. ej. en pruebas).
     *
     * @param solverProvider Recibe la configuración y si el sistema es simétrico.
     */
    public LinearStaticAnalysis(SolverConfig config, BiFunction<SolverConfig, Boolean, ILinearSolver> solverProvider) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.solverProvider = Objects.requireNonNull(solverProvider, "El proveedor de solver no puede ser nulo.");
        this.consolidator = new BoundaryConsolidator(config);
        log.info("LinearStaticAnalysis inicializado. Solver={}, tolLinea={}, tolSingular={}",
                config.getLinearSolverType(), config.getLineTolerance(), config.getSingularityTolerance());
    }

    public Solution solve(Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        Objects.requireNonNull(mesh, "El mallado no puede ser nulo.");
        Objects.requireNonNull(geometry, "La geometría no puede ser nula.");
        Objects.requireNonNull(boundaries, "Los apoyos no pueden ser nulos.");
        Objects.requireNonNull(loads, "Las cargas no pueden ser nulas.");

        validate(mesh, geometry, boundaries, loads);
        log.info("Iniciando cálculo: {} nodos, {} elementos, {} GDL totales.",
                mesh.numberOfNodes(), mesh.numberOfElements(), mesh.totalDof());
        long start = System.nanoTime();

        // 1. Apoyos y cargas a nodos
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // 2. Sistema global
        GlobalSystem system = new GlobalSystem(mesh, table);
        system.assemble();
        system.applyLoads();
        system.applyPrescribedDisplacements();
        system.reduce();

        // 3. Resolución
        ILinearSolver solver = solverProvider.apply(config, system.isSymmetric());
        log.debug("Solver seleccionado: {} (sistema simétrico: {}).", solver.getDescription(), system.isSymmetric());
        system.solve(solver);
        double[] displacement = system.expandSolution();

        // 4. Post-proceso
        StressRecovery recovery = new StressRecovery(mesh, displacement);
        Mesh deformed = recovery.deformedMesh();
        recovery.recover(deformed);

        long elapsed = System.nanoTime() - start;
        Solution solution = Solution.builder()
                .mesh(mesh)
                .deformedMesh(deformed)
                .nodalDisplacements(List.copyOf(recovery.nodalDisplacements()))
                .integrationPoints(recovery.getIntegrationPoints())
                .deformedIntegrationPoints(recovery.getDeformedIntegrationPoints())
                .results(recovery.getResults())
                .displacementVector(displacement)
                .degreesOfFreedom(system.degreesOfFreedom())
                .fixedDofCount(table.fixedDofCount())
                .notices(table.notices())
                .elapsedNanos(elapsed)
                .build();

        this.lastSolution = solution;
        log.info("Cálculo terminado en {} ms. GDL={}, solver={}, avisos={}",
                elapsed / 1_000_000.0, system.degreesOfFreedom(), solver.getName(), table.notices().size());
        return solution;
    }

    /**
     * Comprobaciones previas: mallado no vacío, materiales en rango y referencias resolubles.
     */
    void validate(Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        if (mesh.numberOfNodes() == 0) {
            throw FemModelException.validation("El mallado no tiene nodos.");
        }
        if (mesh.numberOfElements() == 0) {
            throw FemModelException.validation("El mallado no tiene elementos.");
        }
        for (Element element : mesh.elements()) {
            validateSection(element.id(), element.section());
        }

        for (DisplacementConstraint c : boundaries.onNodes()) {
            requireNode(mesh, c.targetId(), "Un apoyo");
        }
        for (Load l : loads.onNodes()) {
            requireNode(mesh, l.targetId(), "Una carga");
        }

        boolean usesPoints = !boundaries.onPoints().isEmpty() || !loads.onPoints().isEmpty();
        boolean usesLines = !boundaries.onLines().isEmpty() || !loads.onLines().isEmpty();
        if ((usesPoints || usesLines) && !geometry.hasPoints()) {
            throw FemModelException.validation(usesLines
                    ? "No se han definido puntos para las líneas."
                    : "No se han definido puntos para los apoyos o cargas sobre puntos.");
        }

        boundaries.onPoints().forEach(c -> geometry.point(c.targetId()));
        loads.onPoints().forEach(l -> geometry.point(l.targetId()));
        boundaries.onLines().forEach(c -> requireLine(geometry, c.targetId()));
        loads.onLines().forEach(l -> requireLine(geometry, l.targetId()));
    }

    private static void validateSection(int elementId, SectionProperties section) {
        if (!(section.youngsModulus() > 0.0)) {
            throw FemModelException.validation("Elemento " + elementId + ": el módulo de Young debe ser positivo ("
                    + section.youngsModulus() + ").");
        }
        if (!(section.thickness() > 0.0)) {
            throw FemModelException.validation("Elemento " + elementId + ": el espesor debe ser positivo ("
                    + section.thickness() + ").");
        }
        if (!(section.poissonsRatio() > -1.0 && section.poissonsRatio() < 0.5)) {
            throw FemModelException.validation("Elemento " + elementId + ": el coeficiente de Poisson debe estar en (-1, 0.5) ("
                    + section.poissonsRatio() + ").");
        }
    }

    private static void requireNode(Mesh mesh, int nodeId, String what) {
        if (!mesh.containsNode(nodeId)) {
            throw FemModelException.validation(what + " referencia el nodo " + nodeId + ", que no existe en el mallado.");
        }
    }

    private static void requireLine(Geometry geometry, int lineId) {
        Line line = geometry.line(lineId);
        geometry.point(line.startPointId());
        geometry.point(line.endPointId());
    }
}
