package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import com.flamingo.ai.interviewinsights.domain.model.InterviewProcess;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.service.scoring.InterviewSignals;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Summarizes which interview round types a company's reports mention. */
@Component
public class InterviewProcessAnalyzer {

  static final double COMMON_ROUND_PERCENT = 30.0;

  private static final Comparator<InterviewProcess.CommonRound> COMMON_ROUND_ORDER =
      Comparator.comparingInt(InterviewProcess.CommonRound::count)
          .reversed()
          .thenComparing(InterviewProcess.CommonRound::roundType);

  public InterviewProcess analyze(Collection<NormalizedDocument> documents) {
    List<NormalizedDocument> corpus = NormalizedDocument.canonicalOrder(documents);
    Map<InterviewRoundType, Integer> roundCounts = new EnumMap<>(InterviewRoundType.class);
    for (NormalizedDocument document : corpus) {
      for (InterviewRoundType type : InterviewSignals.roundTypes(document.tokens())) {
        roundCounts.merge(type, 1, Integer::sum);
      }
    }

    List<InterviewProcess.CommonRound> commonRounds = new ArrayList<>();
    roundCounts.forEach(
        (type, count) -> {
          double percent = count * 100.0 / corpus.size();
          if (percent > COMMON_ROUND_PERCENT) {
            commonRounds.add(
                new InterviewProcess.CommonRound(type, ScoreMath.round(percent, 1), count));
          }
        });
    commonRounds.sort(COMMON_ROUND_ORDER);

    String insight =
        commonRounds.isEmpty()
            ? "Varied interview processes"
            : String.format("Most interviews include %d common round types", commonRounds.size());
    return new InterviewProcess(commonRounds, roundCounts.size(), insight, roundCounts);
  }
}
