package gr.imsi.athenarc.posemir.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;

/**
 * Discovers the translational equivalence classes of a point set.
 */
public interface TecAlgorithm {

    /**
     * Passes each TEC to the sink as soon as it is final. The sink is called on the calling thread
     * while the computation is running and must not modify what it receives.
     */
    void computeTecsToOutput(PointSet pointSet, Consumer<Tec> sink);

    /**
     * Returns all TECs once the computation is complete, in the order they are streamed by
     * {@link #computeTecsToOutput(PointSet, Consumer)}.
     */
    default List<Tec> computeTecs(PointSet pointSet) {
        List<Tec> tecs = new ArrayList<>();
        computeTecsToOutput(pointSet, tecs::add);
        return tecs;
    }
}
