package io.caliban4j.core;

/**
 * Accelerator attached to a job: none, GPUs or TPUs.
 */
public sealed interface Accelerator permits Accelerator.None, Accelerator.Gpu, Accelerator.Tpu {

    JobMode jobMode();

    enum JobMode {
        CPU,
        GPU
    }

    record None() implements Accelerator {
        @Override
        public JobMode jobMode() {
            return JobMode.CPU;
        }
    }

    record Gpu(String type, int count) implements Accelerator {
        public Gpu {
            if (count <= 0) {
                throw new IllegalArgumentException("gpu count must be > 0");
            }
        }

        @Override
        public JobMode jobMode() {
            return JobMode.GPU;
        }
    }

    // TPU hosts still run the CPU image.
    record Tpu(String type, int count) implements Accelerator {
        public Tpu {
            if (count <= 0) {
                throw new IllegalArgumentException("tpu count must be > 0");
            }
        }

        @Override
        public JobMode jobMode() {
            return JobMode.CPU;
        }
    }
}
