package projectelastic.physics.post;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.IntegrationPoint;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.PlanarAssumption;
import projectelastic.domain.mesh.SectionProperties;
import projectelastic.domain.solution.IntegrationPointResult;
import projectelastic.domain.solution.NodalDisplacement;
import projectelastic.physics.element.ElementStiffnessBuilder;
import projectelastic.physics.element.GaussQuadrature;
import projectelastic.physics.element.QuadratureRule;
import projectelastic.physics.element.ShapeFunctions;
import projectelastic.physics.element.StrainDisplacement;
import projectelastic.physics.solver.GlobalSystem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Post-proceso de un vector de desplazamientos global.
 * <p>
 * Por nodo: desplazamientos y módulo. Por punto de Gauss:
 * <ul>
 * <li>ε = B · u_e</li>
 * <li>σ = D · B · u_e</li>
 * <li>σz = 0 (tensión plana) o ν · (σx + σy) (deformación plana)</li>
 * <li>Tensiones principales: autovalores del tensor 3x3, de mayor a menor.</li>
 * <li>Von Mises: sqrt(0.5 · [(σ1−σ2)² + (σ2−σ3)² + (σ3−σ1)²]).</li>
 * </ul>
 */
public class StressRecovery {

    private final Mesh mesh;
    private final double[] displacement;
    private final EigenDecomposition_F64<DMatrixRMaj> eigen = DecompositionFactory_DDRM.eig(3, false, true);

    private List<IntegrationPoint> integrationPoints;
    private List<IntegrationPoint> deformedIntegrationPoints;
    private List<IntegrationPointResult> results;

    /**
     * @param mesh         Mallado original.
     * @param displacement Vector global de desplazamientos (2N).
     */
    public StressRecovery(Mesh mesh, double[] displacement) {
        if (displacement.length != mesh.totalDof()) {
            throw FemModelException.validation("El vector de desplazamientos (" + displacement.length
                    + ") no coincide con los GDL del mallado (" + mesh.totalDof() + ").");
        }
        this.mesh = mesh;
        this.displacement = displacement.clone();
    }

    public List<NodalDisplacement> nodalDisplacements() {
        List<NodalDisplacement> nodal = new ArrayList<>(mesh.numberOfNodes());
        for (int i = 0; i < mesh.numberOfNodes(); i++) {
            nodal.add(NodalDisplacement.of(mesh.nodeAt(i).id(), displacement[2 * i], displacement[2 * i + 1]));
        }
        return nodal;
    }

    /**
     * Mallado original con las coordenadas desplazadas.
     */
    public Mesh deformedMesh() {
        int n = mesh.numberOfNodes();
        double[] dx = new double[n];
        double[] dy = new double[n];
        for (int i = 0; i < n; i++) {
            dx[i] = displacement[2 * i];
            dy[i] = displacement[2 * i + 1];
        }
        return mesh.withDisplacedNodes(dx, dy);
    }

    /**
     * Evalúa todos los puntos de Gauss, elemento a elemento.
     * Los puntos se numeran 1..M en ese mismo orden sobre ambos mallados.
     */
    public void recover(Mesh deformedMesh) {
        List<IntegrationPoint> points = new ArrayList<>();
        List<IntegrationPoint> deformedPoints = new ArrayList<>();
        List<IntegrationPointResult> recovered = new ArrayList<>();
        int nextId = 1;

        for (Element element : mesh.elements()) {
            double[][] coords = mesh.elementCoordinates(element);
            double[][] deformedCoords = deformedMesh.elementCoordinates(deformedMesh.element(element.id()));
            DMatrixRMaj elementDisplacement = elementDisplacement(element);
            DMatrixRMaj d = ElementStiffnessBuilder.materialMatrix(element.section());
            QuadratureRule rule = GaussQuadrature.rule(element.topology(), element.integrationOrder());

            for (int g = 0; g < rule.size(); g++) {
                double xi = rule.xi(g);
                double eta = rule.eta(g);
                double[] n = ShapeFunctions.values(element.topology(), xi, eta);
                double[] xy = ShapeFunctions.interpolate(n, coords);
                double[] deformedXy = ShapeFunctions.interpolate(n, deformedCoords);

                IntegrationPoint point = new IntegrationPoint(nextId, element.id(), xy[0], xy[1]);
                points.add(point);
                deformedPoints.add(new IntegrationPoint(nextId, element.id(), deformedXy[0], deformedXy[1]));
                nextId++;

                StrainDisplacement sd = ElementStiffnessBuilder.strainDisplacement(element, coords, xi, eta);
                recovered.add(evaluate(point, sd.b(), d, elementDisplacement, element.section()));
            }
        }

        this.integrationPoints = List.copyOf(points);
        this.deformedIntegrationPoints = List.copyOf(deformedPoints);
        this.results = List.copyOf(recovered);
    }

    public List<IntegrationPoint> getIntegrationPoints() {
        return integrationPoints;
    }

    public List<IntegrationPoint> getDeformedIntegrationPoints() {
        return deformedIntegrationPoints;
    }

    public List<IntegrationPointResult> getResults() {
        return results;
    }

    private DMatrixRMaj elementDisplacement(Element element) {
        int[] guide = GlobalSystem.guideVector(mesh.elementNodeIndices(element));
        DMatrixRMaj ue = new DMatrixRMaj(guide.length, 1);
        for (int i = 0; i < guide.length; i++) {
            ue.set(i, 0, displacement[guide[i]]);
        }
        return ue;
    }

    private IntegrationPointResult evaluate(IntegrationPoint point, DMatrixRMaj b, DMatrixRMaj d,
                                            DMatrixRMaj ue, SectionProperties section) {
        DMatrixRMaj strain = new DMatrixRMaj(3, 1);
        CommonOps_DDRM.mult(b, ue, strain);
        DMatrixRMaj stress = new DMatrixRMaj(3, 1);
        CommonOps_DDRM.mult(d, strain, stress);

        double sx = stress.get(0);
        double sy = stress.get(1);
        double sxy = stress.get(2);
        double sz = section.planarAssumption() == PlanarAssumption.PLANE_STRAIN
                ? section.poissonsRatio() * (sx + sy)
                : 0.0;

        double[] principal = principalStresses(sx, sy, sxy, sz);
        double vonMises = Math.sqrt(0.5 * (square(principal[0] - principal[1])
                + square(principal[1] - principal[2])
                + square(principal[2] - principal[0])));

        return IntegrationPointResult.builder()
                .point(point)
                .strainX(strain.get(0))
                .strainY(strain.get(1))
                .strainXY(strain.get(2))
                .stressX(sx)
                .stressY(sy)
                .stressXY(sxy)
                .stressZ(sz)
                .principal1(principal[0])
                .principal2(principal[1])
                .principal3(principal[2])
                .vonMises(vonMises)
                .build();
    }

    /**
     * Autovalores del tensor de tensiones completo, ordenados de mayor a menor.
     */
    double[] principalStresses(double sx, double sy, double sxy, double sz) {
        DMatrixRMaj tensor = new DMatrixRMaj(new double[][]{
                {sx, sxy, 0.0},
                {sxy, sy, 0.0},
                {0.0, 0.0, sz}
        });
        if (!eigen.decompose(tensor)) {
            throw FemModelException.numerical("No se ha podido diagonalizar el tensor de tensiones "
                    + Arrays.toString(new double[]{sx, sy, sxy, sz}));
        }
        double[] values = new double[3];
        for (int i = 0; i < 3; i++) {
            values[i] = eigen.getEigenvalue(i).getReal();
        }
        Arrays.sort(values);
        return new double[]{values[2], values[1], values[0]};
    }

    private static double square(double value) {
        return value * value;
    }
}
