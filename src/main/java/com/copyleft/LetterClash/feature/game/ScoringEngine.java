package com.copyleft.LetterClash.feature.game;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.domain.vo.CategoryScore;
import com.copyleft.LetterClash.domain.vo.RoomRules;
import com.copyleft.LetterClash.domain.vo.RoundScore;
import com.copyleft.LetterClash.domain.vo.ScorePair;
import com.copyleft.LetterClash.global.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 라운드의 답안 두 묶음을 채점한다. 상태가 없으며 같은 입력에는 항상 같은 결과를 낸다.
 *
 * <p>평가하는 카테고리 수는 두 답안 길이와 기본 카테고리 수 중 최댓값이다. 라운드에 설정된
 * 카테고리가 더 적어도 기본 개수만큼은 평가하며, 빈 칸은 빈 답안으로 본다.
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    private final GameProperties gameProperties;

    public RoundScore score(List<String> hostAnswers, List<String> guestAnswers, String letter, RoomRules rules) {
        List<String> host = hostAnswers != null ? hostAnswers : List.of();
        List<String> guest = guestAnswers != null ? guestAnswers : List.of();
        int count = Math.max(Math.max(host.size(), guest.size()), gameProperties.defaultCategoryCount());

        List<CategoryScore> categories = new ArrayList<>(count);
        int hostTotal = 0;
        int guestTotal = 0;

        for (int i = 0; i < count; i++) {
            String ha = answerAt(host, i);
            String ga = answerAt(guest, i);

            boolean hostValid = isValid(ha, letter, rules.requireLetter());
            boolean guestValid = isValid(ga, letter, rules.requireLetter());
            boolean duplicate = hostValid && guestValid
                    && TextNormalizer.normalizeWord(ha).equals(TextNormalizer.normalizeWord(ga));
            boolean zeroed = duplicate && rules.dupZero();

            int hostPoints = hostValid && !zeroed ? 1 : 0;
            int guestPoints = guestValid && !zeroed ? 1 : 0;

            hostTotal += hostPoints;
            guestTotal += guestPoints;
            categories.add(new CategoryScore(i, ha, ga, hostValid, guestValid, duplicate, hostPoints, guestPoints));
        }

        return new RoundScore(new ScorePair(hostTotal, guestTotal), categories);
    }

    public boolean isValid(String answer, String letter, boolean requireLetter) {
        if (answer == null || answer.isEmpty()) {
            return false;
        }
        if (TextNormalizer.countLetters(answer) < gameProperties.minAnswerLetters()) {
            return false;
        }
        if (!requireLetter) {
            return true;
        }
        return TextNormalizer.normalizeWord(answer).startsWith(TextNormalizer.normalizeWord(letter));
    }

    private static String answerAt(List<String> answers, int index) {
        if (index >= answers.size()) {
            return "";
        }
        String answer = answers.get(index);
        return answer != null ? answer : "";
    }
}
