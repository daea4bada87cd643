package org.villecon.runtime.model;

/**
 * Building bookkeeping of a village economy.
 * <p>
 * {@code constructionProgress} is the simulated time accumulated towards the next completion.
 */
public final class BuildingState {

    private int count;
    private int targetCount;
    private int constructionQueue;
    private double constructionProgress;

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public void setTargetCount(int targetCount) {
        this.targetCount = targetCount;
    }

    public int getConstructionQueue() {
        return constructionQueue;
    }

    public void setConstructionQueue(int constructionQueue) {
        this.constructionQueue = constructionQueue;
    }

    public double getConstructionProgress() {
        return constructionProgress;
    }

    public void setConstructionProgress(double constructionProgress) {
        this.constructionProgress = constructionProgress;
    }

    @Override
    public String toString() {
        return "Buildings{count=" + count + ", target=" + targetCount + ", queue=" + constructionQueue + "}";
    }
}
