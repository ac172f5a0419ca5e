package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.service.structure.model.RevisionSelection;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the newest snapshot of each entity from file names of the form {@code
 * <name>_<revision>.<ext>}, e.g. {@code 陆八魔亚瑠_123456.md}.
 *
 * <p>Revisions are compared numerically. Two files with the same name and revision are not
 * expected; if they occur, the one listed last wins. Names that do not follow the pattern are
 * reported in {@link RevisionSelection#rejected()} and never abort the selection.
 */
@Component
@Slf4j
public class RevisionSelector {

  private static final Pattern REVISIONED_NAME =
      Pattern.compile("^(?<name>.+)_(?<revision>\\d+)\\.(?<ext>[^.]+)$");

  public RevisionSelection selectLatest(Collection<String> fileNames) {
    Map<String, String> latest = new LinkedHashMap<>();
    Map<String, BigInteger> revisions = new HashMap<>();
    List<String> rejected = new ArrayList<>();

    for (String fileName : fileNames) {
      Matcher matcher = REVISIONED_NAME.matcher(fileName);
      if (!matcher.matches()) {
        log.warn("Ignoring '{}': expected <name>_<revision>.<ext>", fileName);
        rejected.add(fileName);
        continue;
      }
      String name = matcher.group("name");
      BigInteger revision = new BigInteger(matcher.group("revision"));
      BigInteger best = revisions.get(name);
      if (best == null || revision.compareTo(best) >= 0) {
        revisions.put(name, revision);
        latest.put(name, fileName);
      }
    }
    return new RevisionSelection(latest, rejected);
  }
}
