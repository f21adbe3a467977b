package org.jkconfig.frontend.parser;

import org.jkconfig.Kconfig;
import org.jkconfig.KconfigTestSupport;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.SymbolType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Contains tests for the {@link Parser} and the tree finalization that follows it.
 * Each test parses a small Kconfig file written to a temporary source tree.
 */
@Tag("unit")
class ParserTest {

    @TempDir
    Path tempDir;

    private Kconfig parse(String text) throws Exception {
        return KconfigTestSupport.parse(tempDir, text);
    }

    private static MenuNode node(Kconfig kconfig, String name) {
        return kconfig.getSyms().get(name).getNodes().get(0);
    }

    @Test
    void buildsMenuTreeAndRemovesIfBlocks() throws Exception {
        Kconfig kconfig = parse("""
                mainmenu "Test $VERSION"

                config VERSION
                	string
                	default "1.0"

                menu "Menu"
                	depends on A

                config IN_MENU
                	bool "in menu"

                endmenu

                if A
                config IN_IF
                	bool "in if"
                endif

                config A
                	bool "A"
                """);
        MenuNode top = kconfig.getTopNode();
        MenuNode version = top.getList();
        MenuNode menu = version.getNext();
        MenuNode inIf = menu.getNext();
        Symbol a = kconfig.getSyms().get("A");

        assertSame(kconfig.getSyms().get("VERSION"), version.getItem());
        assertEquals(MenuNode.Kind.MENU, menu.getKind());
        assertEquals("Menu", menu.getPrompt().text());
        assertSame(node(kconfig, "IN_MENU"), menu.getList());
        assertSame(menu, node(kconfig, "IN_MENU").getParent());
        assertSame(node(kconfig, "IN_IF"), inIf);
        assertSame(top, inIf.getParent());
        assertSame(a, inIf.getDependency());
        assertSame(a.getNodes().get(0), inIf.getNext());
        assertNull(inIf.getNext().getNext());

        assertEquals("Test $VERSION", top.getPrompt().text());
        assertEquals("Test 1.0", kconfig.mainmenuText());
        assertEquals(new SourceInfo("Kconfig", 1), top.getLocation());
        assertThat(kconfig.nodes()).extracting(MenuNode::getKind).containsExactly(
                MenuNode.Kind.SYMBOL, MenuNode.Kind.MENU, MenuNode.Kind.SYMBOL, MenuNode.Kind.SYMBOL,
                MenuNode.Kind.SYMBOL);
    }

    @Test
    void symbolsDependingOnPredecessorFormImplicitMenu() throws Exception {
        Kconfig kconfig = parse("""
                config PARENT
                	bool "parent"

                config CHILD
                	bool "child"
                	depends on PARENT

                config GRANDCHILD
                	bool "grandchild"
                	depends on CHILD

                config OTHER
                	bool "other"
                """);
        MenuNode parent = node(kconfig, "PARENT");

        assertSame(node(kconfig, "CHILD"), parent.getList());
        assertSame(parent, node(kconfig, "CHILD").getParent());
        assertSame(node(kconfig, "GRANDCHILD"), node(kconfig, "CHILD").getList());
        assertSame(node(kconfig, "OTHER"), parent.getNext());
        assertSame(kconfig.getTopNode(), node(kconfig, "OTHER").getParent());
    }

    @Test
    void readsIndentedHelpText() throws Exception {
        Kconfig kconfig = parse("""
                config H
                	bool "h"
                	help
                	  First line.
                	    Indented.

                	  Third.
                config NEXT
                	bool "next"
                """);

        assertEquals("First line.\n  Indented.\n\nThird.\n", node(kconfig, "H").getHelp());
        assertEquals(new SourceInfo("Kconfig", 8), node(kconfig, "NEXT").getLocation());
    }

    @Test
    void warnsAboutEmptyHelp() throws Exception {
        Kconfig kconfig = parse("""
                config E
                	bool "e"
                	help
                config F
                	bool "f"
                """);

        assertEquals("", node(kconfig, "E").getHelp());
        assertThat(kconfig.getWarnings()).containsExactly(
                "warning: E (defined at Kconfig:1) has 'help' but empty help text");
        assertThat(kconfig.getSyms().get("F").getNodes()).hasSize(1);
    }

    @Test
    void firstTypeWins() throws Exception {
        Kconfig kconfig = parse("""
                config X
                	bool "x"

                config X
                	int
                """);
        Symbol x = kconfig.getSyms().get("X");

        assertEquals(SymbolType.BOOL, x.getOrigType());
        assertThat(x.getNodes()).hasSize(2);
        assertThat(kconfig.getWarnings()).containsExactly(
                "warning: X (defined at Kconfig:1, Kconfig:4) defined with multiple types, bool will be used");
    }

    @Test
    void stripsPromptWhitespaceWithWarning() throws Exception {
        Kconfig kconfig = parse("""
                config P
                	bool " padded "
                """);

        assertEquals("padded", node(kconfig, "P").getPrompt().text());
        assertThat(kconfig.getWarnings()).anyMatch(w -> w.contains("has leading or trailing whitespace in its prompt"));
    }

    @Test
    void defTypesSetTypeAndDefault() throws Exception {
        Kconfig kconfig = parse("""
                config D
                	def_bool y

                config N
                	def_int 42

                config S
                	def_string "abc"
                """);

        assertEquals("y", kconfig.getSyms().get("D").getStrValue());
        assertEquals("42", kconfig.getSyms().get("N").getStrValue());
        assertEquals("abc", kconfig.getSyms().get("S").getStrValue());
    }

    @Test
    void continuationLinesAreJoined() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A" if B && \\
                	            C

                config B
                	def_bool y

                config C
                	def_bool y
                """);

        assertEquals(2, kconfig.getSyms().get("A").getVisibility());
    }

    @Test
    void warnsAboutUndefinedSymbolsOnce() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "a"
                	depends on MISSING
                	range 1 0x10

                config B
                	bool "b"
                	select MISSING
                """);

        assertThat(kconfig.getWarnings()).containsExactly("Kconfig:3: warning: undefined symbol MISSING");
    }

    @Test
    void menuconfigWithoutPromptWarns() throws Exception {
        Kconfig kconfig = parse("""
                menuconfig M
                	bool
                """);

        assertThat(node(kconfig, "M").isMenuconfig()).isTrue();
        assertThat(kconfig.getWarnings()).anyMatch(w -> w.contains("the menuconfig symbol M (defined at Kconfig:1) has no prompt"));
    }

    @Test
    void reportsUnknownStatement() {
        assertThatThrownBy(() -> parse("""
                config FOO
                	bool "foo"
                	foo bar
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("unknown token at start of line")
                .satisfies(e -> assertThat(((KconfigSyntaxException) e).getSourceInfo())
                        .contains(new SourceInfo("Kconfig", 3)));
    }

    @Test
    void reportsUnterminatedMenu() {
        assertThatThrownBy(() -> parse("""
                menu "m"
                config A
                	bool "a"
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("unexpected end of file Kconfig, expected 'endmenu'");
    }

    @Test
    void reportsStrayEndMarker() {
        assertThatThrownBy(() -> parse("endif\n"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("unexpected 'endif'");
    }

    @Test
    void reportsConstantSymbolDefinition() {
        assertThatThrownBy(() -> parse("config y\n"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("expected nonconstant symbol");
    }

    @Test
    void reportsPropertiesOnWrongNodes() {
        assertThatThrownBy(() -> parse("""
                menu "m"
                	select A
                endmenu
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("only symbols can select");

        assertThatThrownBy(() -> parse("""
                config A
                	bool "a"
                	visible if B
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("\"visible if\" is only valid for menus");

        assertThatThrownBy(() -> parse("""
                config A
                	bool "a"
                	option bogus
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("unrecognized option");
    }

    @Test
    void reportsTrailingTokens() {
        assertThatThrownBy(() -> parse("""
                config A
                	bool "a"
                	depends on B C
                """))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("couldn't parse 'depends on B C': extra tokens at end of line");
    }
}
