package com.marketsim.core;

/**
 * <h1>Intrusive Red-Black Tree of Price Levels</h1>
 *
 * <p>
 * Orders one side of the book by price. The {@link PriceLevel} objects are the
 * tree nodes themselves, so inserting or removing a level links pointers and
 * allocates nothing.
 * </p>
 *
 * <p>
 * Best price lookup is a walk down the left spine (asks, minimum) or the right
 * spine (bids, maximum). Depth snapshots walk outward from the best level with
 * {@link #next(PriceLevel, boolean)}.
 * </p>
 *
 * <h2>Red-Black rules kept after every mutation</h2>
 * <ol>
 * <li>Every node is RED or BLACK.</li>
 * <li>The root is BLACK.</li>
 * <li>A RED node has no RED child.</li>
 * <li>Every root-to-leaf path has the same number of BLACK nodes.</li>
 * </ol>
 */
public class RedBlackTree {

    private static final boolean RED = true;
    private static final boolean BLACK = false;

    private PriceLevel root;
    private int size;

    public PriceLevel getRoot() {
        return root;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public PriceLevel find(long price) {
        PriceLevel current = root;
        while (current != null) {
            if (price == current.price) {
                return current;
            }
            current = price < current.price ? current.left : current.right;
        }
        return null;
    }

    /**
     * @param min true for the lowest price (best ask), false for the highest
     *            (best bid)
     */
    public PriceLevel getBestPrice(boolean min) {
        PriceLevel current = root;
        if (current == null) {
            return null;
        }
        if (min) {
            while (current.left != null) {
                current = current.left;
            }
        } else {
            while (current.right != null) {
                current = current.right;
            }
        }
        return current;
    }

    /**
     * Next level away from the best price.
     *
     * @param ascending true walks to the next higher price (asks), false to the
     *                  next lower price (bids)
     * @return the neighbouring level, or null at the end of the side
     */
    public PriceLevel next(PriceLevel node, boolean ascending) {
        return ascending ? successor(node) : predecessor(node);
    }

    /**
     * Inserts a level. A level whose price is already present is ignored; the
     * book never creates two levels for one price.
     */
    public void insert(PriceLevel node) {
        if (node == null) {
            return;
        }

        node.left = null;
        node.right = null;
        node.parent = null;
        node.color = RED;

        if (root == null) {
            root = node;
            root.color = BLACK;
            size = 1;
            return;
        }

        PriceLevel current = root;
        PriceLevel parent = null;
        while (current != null) {
            parent = current;
            if (node.price < current.price) {
                current = current.left;
            } else if (node.price > current.price) {
                current = current.right;
            } else {
                return;
            }
        }

        node.parent = parent;
        if (node.price < parent.price) {
            parent.left = node;
        } else {
            parent.right = node;
        }
        size++;

        fixAfterInsert(node);
    }

    public void remove(PriceLevel node) {
        if (node == null || find(node.price) != node) {
            return;
        }
        deleteNode(node);
        size--;
    }

    // -------------------------------------------------------------------------
    // Insertion fix-up
    // -------------------------------------------------------------------------

    /**
     * A freshly inserted RED node may sit under a RED parent. A RED uncle is
     * resolved by recolouring and moving the problem two levels up; a BLACK
     * uncle by one rotation (outer grandchild) or two (inner grandchild).
     */
    private void fixAfterInsert(PriceLevel node) {
        node.color = RED;

        while (node != null && node != root && isRed(node.parent)) {
            if (parentOf(node) == leftOf(grandparentOf(node))) {
                PriceLevel uncle = rightOf(grandparentOf(node));
                if (isRed(uncle)) {
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparentOf(node), RED);
                    node = grandparentOf(node);
                } else {
                    if (node == rightOf(parentOf(node))) {
                        node = parentOf(node);
                        rotateLeft(node);
                    }
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateRight(grandparentOf(node));
                }
            } else {
                PriceLevel uncle = leftOf(grandparentOf(node));
                if (isRed(uncle)) {
                    setColor(parentOf(node), BLACK);
                    setColor(uncle, BLACK);
                    setColor(grandparentOf(node), RED);
                    node = grandparentOf(node);
                } else {
                    if (node == leftOf(parentOf(node))) {
                        node = parentOf(node);
                        rotateRight(node);
                    }
                    setColor(parentOf(node), BLACK);
                    setColor(grandparentOf(node), RED);
                    rotateLeft(grandparentOf(node));
                }
            }
        }
        root.color = BLACK;
    }

    /**
     * <pre>
     *      P            R
     *     / \          / \
     *    a   R   ==>  P   c
     *       / \      / \
     *      b   c    a   b
     * </pre>
     */
    private void rotateLeft(PriceLevel p) {
        if (p == null) {
            return;
        }
        PriceLevel r = p.right;
        p.right = r.left;
        if (r.left != null) {
            r.left.parent = p;
        }
        r.parent = p.parent;
        if (p.parent == null) {
            root = r;
        } else if (p.parent.left == p) {
            p.parent.left = r;
        } else {
            p.parent.right = r;
        }
        r.left = p;
        p.parent = r;
    }

    /**
     * Mirror of {@link #rotateLeft(PriceLevel)}.
     */
    private void rotateRight(PriceLevel p) {
        if (p == null) {
            return;
        }
        PriceLevel l = p.left;
        p.left = l.right;
        if (l.right != null) {
            l.right.parent = p;
        }
        l.parent = p.parent;
        if (p.parent == null) {
            root = l;
        } else if (p.parent.right == p) {
            p.parent.right = l;
        } else {
            p.parent.left = l;
        }
        l.right = p;
        p.parent = l;
    }

    // -------------------------------------------------------------------------
    // Deletion
    // -------------------------------------------------------------------------

    private void deleteNode(PriceLevel node) {
        // Two children: trade places with the in-order successor so the node
        // to unlink has at most one child. Nodes are swapped, not their
        // contents, because the book holds references to the levels.
        if (node.left != null && node.right != null) {
            swapPositions(node, successor(node));
        }

        PriceLevel replacement = node.left != null ? node.left : node.right;

        if (replacement != null) {
            replacement.parent = node.parent;
            if (node.parent == null) {
                root = replacement;
            } else if (node == node.parent.left) {
                node.parent.left = replacement;
            } else {
                node.parent.right = replacement;
            }
            node.left = null;
            node.right = null;
            node.parent = null;

            if (node.color == BLACK) {
                fixAfterDelete(replacement);
            }
        } else if (node.parent == null) {
            root = null;
        } else {
            // Leaf: fix up while it is still attached, then detach.
            if (node.color == BLACK) {
                fixAfterDelete(node);
            }
            if (node.parent != null) {
                if (node == node.parent.left) {
                    node.parent.left = null;
                } else if (node == node.parent.right) {
                    node.parent.right = null;
                }
                node.parent = null;
            }
        }
    }

    private void fixAfterDelete(PriceLevel x) {
        while (x != root && isBlack(x)) {
            if (x == leftOf(parentOf(x))) {
                PriceLevel sib = rightOf(parentOf(x));

                if (isRed(sib)) {
                    setColor(sib, BLACK);
                    setColor(parentOf(x), RED);
                    rotateLeft(parentOf(x));
                    sib = rightOf(parentOf(x));
                }

                if (isBlack(leftOf(sib)) && isBlack(rightOf(sib))) {
                    setColor(sib, RED);
                    x = parentOf(x);
                } else {
                    if (isBlack(rightOf(sib))) {
                        setColor(leftOf(sib), BLACK);
                        setColor(sib, RED);
                        rotateRight(sib);
                        sib = rightOf(parentOf(x));
                    }
                    setColor(sib, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    setColor(rightOf(sib), BLACK);
                    rotateLeft(parentOf(x));
                    x = root;
                }
            } else {
                PriceLevel sib = leftOf(parentOf(x));

                if (isRed(sib)) {
                    setColor(sib, BLACK);
                    setColor(parentOf(x), RED);
                    rotateRight(parentOf(x));
                    sib = leftOf(parentOf(x));
                }

                if (isBlack(rightOf(sib)) && isBlack(leftOf(sib))) {
                    setColor(sib, RED);
                    x = parentOf(x);
                } else {
                    if (isBlack(leftOf(sib))) {
                        setColor(rightOf(sib), BLACK);
                        setColor(sib, RED);
                        rotateLeft(sib);
                        sib = leftOf(parentOf(x));
                    }
                    setColor(sib, colorOf(parentOf(x)));
                    setColor(parentOf(x), BLACK);
                    setColor(leftOf(sib), BLACK);
                    rotateRight(parentOf(x));
                    x = root;
                }
            }
        }
        setColor(x, BLACK);
    }

    /**
     * Exchanges the tree positions (links and colours) of {@code x} and its
     * in-order successor {@code y}. {@code y} is either x's right child or a
     * node somewhere below it.
     */
    private void swapPositions(PriceLevel x, PriceLevel y) {
        PriceLevel xParent = x.parent;
        PriceLevel xLeft = x.left;
        PriceLevel xRight = x.right;
        boolean xColor = x.color;

        PriceLevel yParent = y.parent;
        PriceLevel yLeft = y.left;
        PriceLevel yRight = y.right;
        boolean yColor = y.color;

        boolean yIsRightChild = (y == xRight);

        y.parent = xParent;
        if (xParent != null) {
            if (xParent.left == x) {
                xParent.left = y;
            } else {
                xParent.right = y;
            }
        } else {
            root = y;
        }
        y.left = xLeft;
        if (xLeft != null) {
            xLeft.parent = y;
        }
        if (yIsRightChild) {
            y.right = x;
        } else {
            y.right = xRight;
            if (xRight != null) {
                xRight.parent = y;
            }
        }
        y.color = xColor;

        if (yIsRightChild) {
            x.parent = y;
        } else {
            x.parent = yParent;
            if (yParent != null) {
                if (yParent.left == y) {
                    yParent.left = x;
                } else {
                    yParent.right = x;
                }
            }
        }
        x.left = yLeft;
        if (yLeft != null) {
            yLeft.parent = x;
        }
        x.right = yRight;
        if (yRight != null) {
            yRight.parent = x;
        }
        x.color = yColor;
    }

    // -------------------------------------------------------------------------
    // Null-safe helpers
    // -------------------------------------------------------------------------

    private static boolean isRed(PriceLevel p) {
        return p != null && p.color == RED;
    }

    private static boolean isBlack(PriceLevel p) {
        return p == null || p.color == BLACK;
    }

    private static boolean colorOf(PriceLevel p) {
        return p == null ? BLACK : p.color;
    }

    private static PriceLevel parentOf(PriceLevel p) {
        return p == null ? null : p.parent;
    }

    private static PriceLevel grandparentOf(PriceLevel p) {
        return (p != null && p.parent != null) ? p.parent.parent : null;
    }

    private static void setColor(PriceLevel p, boolean c) {
        if (p != null) {
            p.color = c;
        }
    }

    private static PriceLevel leftOf(PriceLevel p) {
        return p == null ? null : p.left;
    }

    private static PriceLevel rightOf(PriceLevel p) {
        return p == null ? null : p.right;
    }

    private static PriceLevel successor(PriceLevel t) {
        if (t == null) {
            return null;
        }
        if (t.right != null) {
            PriceLevel p = t.right;
            while (p.left != null) {
                p = p.left;
            }
            return p;
        }
        PriceLevel p = t.parent;
        PriceLevel ch = t;
        while (p != null && ch == p.right) {
            ch = p;
            p = p.parent;
        }
        return p;
    }

    private static PriceLevel predecessor(PriceLevel t) {
        if (t == null) {
            return null;
        }
        if (t.left != null) {
            PriceLevel p = t.left;
            while (p.right != null) {
                p = p.right;
            }
            return p;
        }
        PriceLevel p = t.parent;
        PriceLevel ch = t;
        while (p != null && ch == p.left) {
            ch = p;
            p = p.parent;
        }
        return p;
    }
}
