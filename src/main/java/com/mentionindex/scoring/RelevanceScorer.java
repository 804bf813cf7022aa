package com.mentionindex.scoring;

import com.mentionindex.config.Constants;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.text.NameNormalizer;
import com.mentionindex.text.Tokenizer;
import com.mentionindex.text.WordTokenizer;

import java.util.List;

/**
 * 全文检索的加权评分。每个查询词只取命中的最高一档：
 * 姓名词完全相同、姓名词子串、公司名词、职位或部门子串。
 */
public class RelevanceScorer {

    private final Tokenizer tokenizer;

    public RelevanceScorer() {
        this(new WordTokenizer());
    }

    public RelevanceScorer(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * @param queryWords 已规范化的查询词
     */
    public int score(PersonRecord person, List<String> queryWords) {
        List<String> nameWords = tokenizer.terms(person.canonicalName());
        List<String> companyWords = tokenizer.terms(NameNormalizer.normalize(person.companyName()));
        String position = NameNormalizer.normalize(person.position());
        String department = NameNormalizer.normalize(person.department());

        int score = 0;
        for (String queryWord : queryWords) {
            if (nameWords.contains(queryWord)) {
                score += Constants.SCORE_NAME_WORD_EXACT;
            } else if (nameWords.stream().anyMatch(word -> word.contains(queryWord))) {
                score += Constants.SCORE_NAME_WORD_PARTIAL;
            } else if (companyWords.contains(queryWord)) {
                score += Constants.SCORE_COMPANY_WORD;
            } else if (!position.isEmpty() && position.contains(queryWord)) {
                score += Constants.SCORE_POSITION_OR_DEPARTMENT;
            } else if (!department.isEmpty() && department.contains(queryWord)) {
                score += Constants.SCORE_POSITION_OR_DEPARTMENT;
            }
        }
        return score;
    }
}
