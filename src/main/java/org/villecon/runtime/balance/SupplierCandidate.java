package org.villecon.runtime.balance;

import org.villecon.runtime.model.Village;

/**
 * A village able to supply a resource to a village in shortage.
 *
 * @param village         the supplying village.
 * @param distance        Euclidean distance to the village in shortage.
 * @param availableSupply amount the supplier can spare.
 * @param supplyCapacity  spare amount discounted by distance; candidates are ranked by it.
 */
public record SupplierCandidate(Village village, double distance, double availableSupply, double supplyCapacity) {
}
