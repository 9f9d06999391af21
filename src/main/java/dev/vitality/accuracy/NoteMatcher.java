package dev.vitality.accuracy;

import dev.vitality.note.ExtractedNote;
import java.util.List;

/** Pairs an extracted note with the expected note it most likely corresponds to. */
public interface NoteMatcher {

  MatchResult findMatch(ExtractedNote note, List<ExpectedNote> candidates);
}
