package com.marketsim.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RedBlackTreeTest {

    private RedBlackTree tree;

    @BeforeEach
    public void setup() {
        tree = new RedBlackTree();
    }

    private PriceLevel level(long price) {
        PriceLevel node = new PriceLevel();
        node.reset();
        node.price = price;
        return node;
    }

    @Test
    public void firstLevelBecomesBlackRoot() {
        PriceLevel node = level(10_000);
        tree.insert(node);

        assertSame(node, tree.getRoot());
        assertFalse(node.color, "Root must always be BLACK");
        assertNull(node.parent);
        assertEquals(1, tree.size());
    }

    @Test
    public void redUncleIsResolvedByRecolouring() {
        // 10(B) with 5(R) and 15(R); inserting 1 recolours 5 and 15 black
        tree.insert(level(10));
        tree.insert(level(5));
        tree.insert(level(15));
        tree.insert(level(1));

        assertFalse(tree.getRoot().color, "Root 10 is Black");
        assertFalse(tree.getRoot().left.color, "Node 5 is Black");
        assertFalse(tree.getRoot().right.color, "Node 15 is Black");
        assertTrue(tree.getRoot().left.left.color, "Node 1 is Red");
    }

    @Test
    public void leftLeaningLineIsRotatedRight() {
        tree.insert(level(10));
        tree.insert(level(5));
        tree.insert(level(1));

        // 5(B) / 1(R) 10(R)
        assertEquals(5, tree.getRoot().price);
        assertFalse(tree.getRoot().color);
        assertEquals(1, tree.getRoot().left.price);
        assertTrue(tree.getRoot().left.color);
        assertEquals(10, tree.getRoot().right.price);
        assertTrue(tree.getRoot().right.color);
    }

    @Test
    public void rightLeaningLineIsRotatedLeft() {
        tree.insert(level(10));
        tree.insert(level(15));
        tree.insert(level(20));

        assertEquals(15, tree.getRoot().price);
        assertFalse(tree.getRoot().color);
        assertEquals(10, tree.getRoot().left.price);
        assertEquals(20, tree.getRoot().right.price);
    }

    @Test
    public void bestPriceIsMinimumForAsksAndMaximumForBids() {
        for (long price : new long[] {50, 20, 80, 10, 30}) {
            tree.insert(level(price));
        }

        assertEquals(10, tree.getBestPrice(true).price, "best ask is the lowest price");
        assertEquals(80, tree.getBestPrice(false).price, "best bid is the highest price");
    }

    @Test
    public void nextWalksOutwardFromBestInBothDirections() {
        for (long price : new long[] {50, 20, 80, 10, 30, 60, 90}) {
            tree.insert(level(price));
        }

        StringBuilder ascending = new StringBuilder();
        for (PriceLevel l = tree.getBestPrice(true); l != null; l = tree.next(l, true)) {
            ascending.append(l.price).append(' ');
        }
        StringBuilder descending = new StringBuilder();
        for (PriceLevel l = tree.getBestPrice(false); l != null; l = tree.next(l, false)) {
            descending.append(l.price).append(' ');
        }

        assertEquals("10 20 30 50 60 80 90 ", ascending.toString());
        assertEquals("90 80 60 50 30 20 10 ", descending.toString());
    }

    @Test
    public void duplicatePriceIsIgnored() {
        PriceLevel first = level(100);
        tree.insert(first);
        tree.insert(level(100));

        assertEquals(1, tree.size());
        assertSame(first, tree.find(100));
    }

    @Test
    public void removingNodeWithTwoChildrenKeepsOtherLevelsReachable() {
        PriceLevel[] nodes = new PriceLevel[7];
        long[] prices = {40, 20, 60, 10, 30, 50, 70};
        for (int i = 0; i < prices.length; i++) {
            nodes[i] = level(prices[i]);
            tree.insert(nodes[i]);
        }

        tree.remove(nodes[0]);

        assertEquals(6, tree.size());
        assertNull(tree.find(40));
        for (int i = 1; i < prices.length; i++) {
            assertSame(nodes[i], tree.find(prices[i]), "level " + prices[i] + " must survive");
        }
        assertNull(nodes[0].parent);
        assertNull(nodes[0].left);
        assertNull(nodes[0].right);
    }

    @Test
    public void removingForeignLevelIsNoOp() {
        tree.insert(level(100));
        tree.remove(level(100));

        assertEquals(1, tree.size());
        assertNotNull(tree.find(100));
    }

    @Test
    public void removingLastLevelEmptiesTree() {
        PriceLevel only = level(100);
        tree.insert(only);
        tree.remove(only);

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertNull(tree.getBestPrice(true));
        assertNull(tree.getBestPrice(false));
    }
}
