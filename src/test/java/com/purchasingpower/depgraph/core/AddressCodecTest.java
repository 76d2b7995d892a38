package com.purchasingpower.depgraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Address codec")
class AddressCodecTest {

    private static final String CANONICAL = "shop/src/cart/Cart.ts#Class:Cart";

    @Test
    @DisplayName("Should build canonical address with normalized path")
    void createNormalizesPath() {
        String address = AddressCodec.create("shop", ".\\src\\\\cart\\Cart.ts", NodeType.CLASS, "Cart");

        assertThat(address).isEqualTo(CANONICAL);
    }

    @Test
    void parseSplitsAllComponents() {
        ParsedAddress parsed = AddressCodec.parse("shop/src/cart/Cart.ts#Method:Cart.addItem");

        assertThat(parsed.isValid()).isTrue();
        assertThat(parsed.getErrors()).isEmpty();
        assertThat(parsed.getProjectName()).isEqualTo("shop");
        assertThat(parsed.getFilePath()).isEqualTo("src/cart/Cart.ts");
        assertThat(parsed.getNodeType()).isEqualTo(NodeType.METHOD);
        assertThat(parsed.getSymbolName()).isEqualTo("Cart.addItem");
    }

    @Test
    @DisplayName("Symbol names may contain colons and hashes")
    void symbolKeepsEverythingAfterFirstColon() {
        ParsedAddress parsed = AddressCodec.parse("shop/a.ts#Function:ns::helper#1");

        assertThat(parsed.isValid()).isTrue();
        assertThat(parsed.getFilePath()).isEqualTo("a.ts");
        assertThat(parsed.getSymbolName()).isEqualTo("ns::helper#1");
    }

    @Test
    void relationalLabelsAreRecognized() {
        ParsedAddress parsed = AddressCodec.parse("shop/docs/readme.md#parsed-by:markdown");

        assertThat(parsed.isValid()).isTrue();
        assertThat(parsed.getNodeType()).isEqualTo(NodeType.PARSED_BY);
    }

    @Test
    void unknownNodeTypeIsReported() {
        ParsedAddress parsed = AddressCodec.parse("shop/a.ts#Widget:Foo");

        assertThat(parsed.isValid()).isFalse();
        assertThat(parsed.getErrors()).containsExactly("Unknown node type: Widget");
        assertThat(parsed.getProjectName()).isNull();
    }

    @Test
    void labelsAreCaseSensitive() {
        assertThat(AddressCodec.parse("shop/a.ts#class:Foo").isValid()).isFalse();
    }

    @Test
    void emptyAndMalformedInputNeverThrows() {
        assertThat(AddressCodec.parse(null).getErrors()).containsExactly("Address is empty");
        assertThat(AddressCodec.parse("   ").isValid()).isFalse();
        assertThat(AddressCodec.parse("no-separators").getErrors())
                .singleElement().asString().startsWith("Invalid address format");
    }

    @Test
    void missingPartsAreNamed() {
        ParsedAddress parsed = AddressCodec.parse("/a.ts#Class:");

        assertThat(parsed.isValid()).isFalse();
        assertThat(parsed.getErrors()).contains("Project name is empty", "Symbol name is empty");
    }

    @Test
    void validateMirrorsParse() {
        assertThat(AddressCodec.validate(CANONICAL).valid()).isTrue();
        assertThat(AddressCodec.validate(CANONICAL).errors()).isEmpty();
        assertThat(AddressCodec.validate("shop/a.ts#Nope:X").errors()).isNotEmpty();
    }

    @Test
    @DisplayName("Normalize should be idempotent")
    void normalizeIsIdempotent() {
        String once = AddressCodec.normalize("shop/.//src\\cart//Cart.ts#Class:Cart");

        assertThat(once).isEqualTo(CANONICAL);
        assertThat(AddressCodec.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalizeLeavesInvalidInputMostlyAlone() {
        assertThat(AddressCodec.normalize("bad\\input")).isEqualTo("bad/input");
        assertThat(AddressCodec.normalize(null)).isNull();
    }

    @Test
    void compareIgnoresPathSpelling() {
        assertThat(AddressCodec.compare(CANONICAL, "shop/./src\\cart/Cart.ts#Class:Cart")).isTrue();
        assertThat(AddressCodec.compare(CANONICAL, "shop/src/cart/Cart.ts#Interface:Cart")).isFalse();
        assertThat(AddressCodec.compare(CANONICAL, "garbage")).isFalse();
    }

    @Test
    void extractorsReturnNullForInvalidInput() {
        assertThat(AddressCodec.extractProjectName(CANONICAL)).isEqualTo("shop");
        assertThat(AddressCodec.extractFilePath(CANONICAL)).isEqualTo("src/cart/Cart.ts");
        assertThat(AddressCodec.extractNodeType(CANONICAL)).isEqualTo(NodeType.CLASS);
        assertThat(AddressCodec.extractSymbolName(CANONICAL)).isEqualTo("Cart");

        assertThat(AddressCodec.extractProjectName("x")).isNull();
        assertThat(AddressCodec.extractNodeType("x")).isNull();
    }

    @Test
    void roundTripThroughAddressValue() {
        Address address = AddressCodec.toAddress(CANONICAL).orElseThrow();

        assertThat(address.toCanonical()).isEqualTo(CANONICAL);
        assertThat(Address.of("shop", "/src/cart/Cart.ts", NodeType.CLASS, "Cart")).isEqualTo(address);
        assertThat(AddressCodec.toAddress("x")).isEmpty();
    }

    @Test
    void normalizePathStripsLeadingSegments() {
        assertThat(AddressCodec.normalizePath("././//a//b\\c.ts")).isEqualTo("a/b/c.ts");
        assertThat(AddressCodec.normalizePath(null)).isEmpty();
    }
}
