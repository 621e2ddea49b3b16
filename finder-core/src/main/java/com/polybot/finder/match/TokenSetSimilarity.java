package com.polybot.finder.match;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Word-order-insensitive similarity in [0, 100] over canonicalized text.
 * <p>
 * Both inputs are reduced to sorted sets of unique words. When they share a word and one set contains the other the
 * score is 100. Otherwise the shared words {@code S}, and {@code S} extended by each side's remaining words, are
 * compared pairwise with the normalized Indel similarity and the best pair wins.
 */
@UtilityClass
public class TokenSetSimilarity {

  public static double score(String left, String right) {
    TreeSet<String> a = tokens(left);
    TreeSet<String> b = tokens(right);
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }

    TreeSet<String> intersection = new TreeSet<>(a);
    intersection.retainAll(b);
    TreeSet<String> onlyA = new TreeSet<>(a);
    onlyA.removeAll(b);
    TreeSet<String> onlyB = new TreeSet<>(b);
    onlyB.removeAll(a);

    if (!intersection.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
      return 100.0;
    }

    String sect = String.join(" ", intersection);
    String diffA = String.join(" ", onlyA);
    String diffB = String.join(" ", onlyB);

    int sectLen = sect.length();
    int separator = sectLen == 0 ? 0 : 1;
    int sectALen = sectLen + separator + diffA.length();
    int sectBLen = sectLen + separator + diffB.length();

    // sect + diffA vs sect + diffB: the shared prefix cancels out of the distance.
    int dist = indelDistance(diffA, diffB);
    double best = normalizedSimilarity(dist, sectALen + sectBLen);
    if (sectLen == 0) {
      return best;
    }

    // sect vs sect + diff: the distance is exactly the appended suffix.
    best = Math.max(best, normalizedSimilarity(separator + diffA.length(), sectLen + sectALen));
    best = Math.max(best, normalizedSimilarity(separator + diffB.length(), sectLen + sectBLen));
    return best;
  }

  static TreeSet<String> tokens(String text) {
    if (text == null || text.isBlank()) {
      return new TreeSet<>();
    }
    return new TreeSet<>(Set.copyOf(Arrays.asList(text.trim().split(" +"))));
  }

  /**
   * Insertions plus deletions needed to turn {@code s1} into {@code s2}: {@code len1 + len2 - 2 * lcs}.
   */
  static int indelDistance(String s1, String s2) {
    return s1.length() + s2.length() - 2 * longestCommonSubsequence(s1, s2);
  }

  private static int longestCommonSubsequence(String s1, String s2) {
    if (s1.isEmpty() || s2.isEmpty()) {
      return 0;
    }
    int[] prev = new int[s2.length() + 1];
    int[] curr = new int[s2.length() + 1];
    for (int i = 1; i <= s1.length(); i++) {
      char c = s1.charAt(i - 1);
      for (int j = 1; j <= s2.length(); j++) {
        if (c == s2.charAt(j - 1)) {
          curr[j] = prev[j - 1] + 1;
        } else {
          curr[j] = Math.max(prev[j], curr[j - 1]);
        }
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[s2.length()];
  }

  private static double normalizedSimilarity(int distance, int totalLength) {
    if (totalLength == 0) {
      return 100.0;
    }
    return 100.0 * (1.0 - (double) distance / totalLength);
  }
}
