package gr.imsi.athenarc.posemir.discovery;

import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Consumer;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.domain.Vector;
import gr.imsi.athenarc.posemir.matching.ExactMatcher;

/**
 * SIATEC variant that only follows translators seeded by pairs of points at most {@code maxIoi}
 * apart in onset.
 * <ol>
 *     <li>the restricted MTPs group every such pair by its difference vector;</li>
 *     <li>the vectors between sources of the same restricted MTP become candidate translators;</li>
 *     <li>each candidate's full MTP is consolidated into a TEC, skipping shapes already emitted.</li>
 * </ol>
 * Candidates are processed in ascending vector order, so the output order is reproducible.
 * A larger {@code maxIoi} only adds candidates, never removes them.
 */
public class SiatecC implements TecAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(SiatecC.class);

    private final MtpBuilder mtpBuilder;
    private final ExactMatcher matcher;

    public SiatecC(BigFraction maxIoi) {
        this(maxIoi, new ExactMatcher());
    }

    public SiatecC(BigFraction maxIoi, ExactMatcher matcher) {
        this.mtpBuilder = new MtpBuilder(maxIoi);
        this.matcher = Preconditions.checkNotNull(matcher, "Matcher must not be null");
    }

    public BigFraction getMaxIoi() {
        return mtpBuilder.getMaxIoi();
    }

    @Override
    public void computeTecsToOutput(PointSet pointSet, Consumer<Tec> sink) {
        Preconditions.checkNotNull(pointSet, "Point set must not be null");
        Preconditions.checkArgument(!pointSet.isEmpty(), "Cannot discover patterns in an empty point set");
        Preconditions.checkNotNull(sink, "Sink must not be null");

        Stopwatch stopwatch = Stopwatch.createStarted();
        TecConsolidator consolidator = new TecConsolidator(pointSet, matcher);
        SortedSet<Vector> candidates = consolidator.candidateTranslators(mtpBuilder.computeRestrictedMtps(pointSet));

        int emitted = 0;
        for (Vector candidate : candidates) {
            Optional<Mtp> mtp = MtpBuilder.computeMtp(pointSet, candidate);
            if (!mtp.isPresent()) {
                LOG.debug("Candidate translator {} maps no point into the point set, skipping it", candidate);
                continue;
            }
            Tec tec = consolidator.consolidate(mtp.get()).orElse(null);
            if (tec != null) {
                sink.accept(tec);
                emitted++;
            }
        }
        LOG.info("SIATEC-C (max IOI {}) found {} TECs from {} candidate translators over {} points in {}",
            getMaxIoi(), emitted, candidates.size(), pointSet.size(), stopwatch);
    }
}
