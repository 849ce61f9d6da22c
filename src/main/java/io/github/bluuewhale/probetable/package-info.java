/**
 * String-keyed hash table with linear probing, eager cluster rehash on delete
 * and growth through a fixed ladder of prime capacities.
 */
@NullMarked
package io.github.bluuewhale.probetable;

import org.jspecify.annotations.NullMarked;
