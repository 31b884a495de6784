package io.clarity.core.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import io.clarity.core.error.ClaritySyntaxException;
import io.clarity.core.error.LexicalException;
import io.clarity.core.knowledge.BocAst.*;
import io.clarity.core.lexer.Position;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class KnowledgeParserTest {

  @Test
  void parsesBeliefWithInlineConfidence() {
    Program program =
        KnowledgeParser.parse(
            "belief confidence=0.85 {\n"
                + "    fact: \"temperature_in_celsius(22.5)\"\n"
                + "    source: \"sensor_123\"\n"
                + "}");

    Block belief = (Block) program.statements().get(0);
    assertEquals(BlockKind.BELIEF, belief.kind());
    assertEquals(0.85, ((Literal) belief.confidence()).value());
    assertNull(belief.action());
    assertEquals(2, belief.content().size());
    Entry fact = belief.content().get(0);
    assertEquals("fact", fact.key());
    assertEquals("temperature_in_celsius(22.5)", ((Literal) fact.value()).value());
    assertEquals(new Position(1, 0), belief.position());
  }

  @Test
  void parsesIntentWithActionAndAttributes() {
    Block intent =
        (Block)
            KnowledgeParser.parse(
                    "intent to_perform: \"coordinate_meeting\" @priority(\"high\") @urgent {\n"
                        + "    participants: [\"agent_a\", \"agent_b\"]\n"
                        + "}")
                .statements()
                .get(0);

    assertEquals(BlockKind.INTENT, intent.kind());
    assertEquals("coordinate_meeting", ((Literal) intent.action()).value());
    assertEquals(List.of("priority", "urgent"), List.copyOf(intent.attributes().keySet()));
    assertEquals("high", ((Literal) intent.attributes().get("priority")).value());
    assertEquals(Boolean.TRUE, ((Literal) intent.attributes().get("urgent")).value());
    ArrayExpr participants = (ArrayExpr) intent.content().get(0).value();
    assertEquals(2, participants.items().size());
  }

  @Test
  void parsesTopLevelAssignment() {
    Program program = KnowledgeParser.parse("threshold = 0.7; owner = agent_a");
    Assignment first = (Assignment) program.statements().get(0);
    assertEquals("threshold", first.name());
    Assignment second = (Assignment) program.statements().get(1);
    assertEquals("agent_a", ((Ref) second.value()).name());
  }

  @Test
  void entriesMayBeBareAndSeparatedFreely() {
    Block block =
        (Block) KnowledgeParser.parse("shared_state { \"x\", y; 3 true }").statements().get(0);
    assertEquals(4, block.content().size());
    assertTrue(block.content().stream().noneMatch(Entry::isKeyValue));
    assertEquals(3L, ((Literal) block.content().get(2).value()).value());
  }

  @Test
  void blockKeywordsMayBeUsedAsKeys() {
    Block block =
        (Block)
            KnowledgeParser.parse("structured_knowledge { intent: \"x\" belief: 1 }")
                .statements()
                .get(0);
    assertEquals("intent", block.content().get(0).key());
    assertEquals("belief", block.content().get(1).key());
  }

  @Test
  void everyBlockKindIsAccepted() {
    Program program =
        KnowledgeParser.parse(
            "belief {} reasoning_context {} intent {} shared_state {} self_capability {}"
                + " calculate_with_uncertainty {} structured_knowledge {}");
    assertEquals(BlockKind.values().length, program.statements().size());
  }

  @Test
  void emptyInputIsAnEmptyProgram() {
    assertTrue(KnowledgeParser.parse("  // nothing here\n").statements().isEmpty());
  }

  @Test
  void hugeIntegersStayExact() {
    Block block =
        (Block) KnowledgeParser.parse("belief { n: 123456789012345678901234 }").statements().get(0);
    assertEquals(
        new BigInteger("123456789012345678901234"),
        ((Literal) block.content().get(0).value()).value());
  }

  @Test
  void missingValueIsASyntaxError() {
    ClaritySyntaxException e =
        assertThrows(ClaritySyntaxException.class, () -> KnowledgeParser.parse("belief { fact: }"));
    assertEquals("Expected literal, identifier or array, got RBRACE '}'", e.detail());
    assertEquals(new Position(1, 15), e.position());
  }

  @Test
  void unknownStatementIsASyntaxError() {
    ClaritySyntaxException e =
        assertThrows(ClaritySyntaxException.class, () -> KnowledgeParser.parse("42"));
    assertEquals("Expected block keyword or assignment, got NUMBER '42'", e.detail());
  }

  @Test
  void unclosedBlockReportsEndOfInput() {
    ClaritySyntaxException e =
        assertThrows(ClaritySyntaxException.class, () -> KnowledgeParser.parse("intent {"));
    assertEquals("Expected RBRACE '}', got end of input", e.detail());
  }

  @Test
  void arraysNeedCommas() {
    assertThrows(ClaritySyntaxException.class, () -> KnowledgeParser.parse("x = [1 2]"));
  }

  @Test
  void surfaceOperatorsAreNotDialectTokens() {
    assertThrows(LexicalException.class, () -> KnowledgeParser.parse("x = -1"));
  }
}
