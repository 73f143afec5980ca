package org.irradcontrol.node;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.irradcontrol.node.config.LogChannelAppender;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.node.discovery.DescriptorFile;
import org.irradcontrol.node.spi.CommandContext;
import org.irradcontrol.node.spi.CommandTable;
import org.irradcontrol.node.spi.IDataPublisher;
import org.irradcontrol.node.spi.IProcess;
import org.irradcontrol.node.spi.IProcessContext;
import org.irradcontrol.node.spi.IRoleHandler;
import org.irradcontrol.node.threads.Flag;
import org.irradcontrol.node.threads.Task;
import org.irradcontrol.node.threads.ThreadWatcher;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.Command;
import org.irradcontrol.protocol.DataPacket;
import org.irradcontrol.protocol.EventRecord;
import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.protocol.ProtocolException;
import org.irradcontrol.protocol.Reply;
import org.irradcontrol.transport.Endpoint;
import org.irradcontrol.transport.InternalBus;
import org.irradcontrol.transport.InternalPublisher;
import org.irradcontrol.transport.PortAllocator;
import org.irradcontrol.transport.PublisherSocket;
import org.irradcontrol.transport.ReplySocket;
import org.irradcontrol.transport.SubscriberSocket;
import org.irradcontrol.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The process every node role runs in.
 * <p>
 * On start it binds the four channel sockets ({@code log}, {@code cmd}, {@code data},
 * {@code event}), installs a shutdown hook, writes the process descriptor and launches the
 * command receiver and the publish bridge. The thread that calls {@link #run()} then becomes
 * the watcher: it reports failed worker threads until shutdown is requested, waits for all
 * workers to return and tears the process down.
 * <p>
 * Threads never write to the publish sockets directly. Each thread publishes through its own
 * {@link InternalPublisher}; the publish bridge is the single writer of the {@code log},
 * {@code data} and {@code event} sockets. The {@code cmd} socket is written only by the command
 * receiver, which reads no further command while one is in flight.
 */
public final class ProcessCore implements IProcess, IProcessContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCore.class);

    /**
     * Lifecycle of a process core.
     */
    public enum State {
        NEW,
        STARTING,
        RUNNING,
        STOPPING,
        STOPPED,
        FAILED
    }

    private final IRoleHandler role;
    private final ProcessSettings settings;
    private final String name;
    private final long pid = ProcessHandle.current().pid();
    private final ThreadWatcher watcher;
    private final InternalBus bus;
    private final ThreadLocal<InternalPublisher> publishers;
    private final DescriptorFile descriptorFile;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final List<Flag> stopFlags = new CopyOnWriteArrayList<>();
    private final Flag stopping = new Flag();
    private final Flag started = new Flag();
    private final Flag terminated = new Flag();
    private final Flag busy = new Flag();
    private final BlockingQueue<PendingReply> outgoing = new LinkedBlockingQueue<>();
    private final Map<ChannelKind, Integer> ports = Collections.synchronizedMap(new EnumMap<>(ChannelKind.class));
    private final List<SubscriberSocket> subscriptions = new CopyOnWriteArrayList<>();

    private CommandTable commands;
    private ReplySocket cmdSocket;
    private PublisherSocket logSocket;
    private PublisherSocket dataSocket;
    private PublisherSocket eventSocket;
    private SubscriberSocket eventSubscription;
    private LogChannelAppender logAppender;
    private Thread shutdownHook;
    private Thread mainThread;
    private volatile RuntimeException startupFailure;

    public ProcessCore(final IRoleHandler role, final ProcessSettings settings) {
        this.role = role;
        this.settings = settings;
        this.name = role.roleName();
        this.watcher = new ThreadWatcher(name);
        this.bus = new InternalBus(name + "-internal", settings.internalQueueCapacity());
        this.publishers = ThreadLocal.withInitial(bus::createPublisher);
        this.descriptorFile = new DescriptorFile(settings.descriptorDir(), name);
    }

    /**
     * Starts the process on a thread of its own.
     */
    @Override
    public void start() {
        mainThread = new Thread(this::run, name + "-main");
        mainThread.start();
    }

    /**
     * Requests shutdown and waits until the process has been torn down.
     */
    @Override
    public void stop() {
        shutdown();
        if (mainThread != null && mainThread != Thread.currentThread()) {
            try {
                mainThread.join(settings.shutdownTimeout().multipliedBy(2).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while waiting for {} to stop", name);
            }
        }
    }

    /**
     * Sets up the process and runs the watcher loop on the calling thread until shutdown.
     *
     * @throws TransportException if the channel sockets cannot be bound.
     * @throws org.irradcontrol.node.discovery.DescriptorException if the descriptor cannot be written.
     */
    public void run() {
        if (!state.compareAndSet(State.NEW, State.STARTING)) {
            throw new IllegalStateException("Process '" + name + "' cannot be started in state " + state.get());
        }
        try {
            setUp();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to start {}: {}", name, e.getMessage());
            startupFailure = e;
            state.set(State.FAILED);
            shutdown();
            tearDown();
            throw e;
        }
        state.set(State.RUNNING);
        started.set();
        LOGGER.info("{} running with pid {} on ports {}", name, pid, ports);

        try {
            watch();
        } finally {
            tearDown();
        }
    }

    /**
     * Blocks until the process serves commands.
     *
     * @return {@code true} once running, {@code false} on timeout.
     * @throws IllegalStateException if start-up failed.
     */
    public boolean awaitStarted(final Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (startupFailure != null) {
                throw new IllegalStateException("Process '" + name + "' failed to start", startupFailure);
            }
            if (started.await(settings.stopPoll())) {
                return true;
            }
        }
        return started.isSet();
    }

    public boolean awaitTerminated(final Duration timeout) throws InterruptedException {
        return terminated.await(timeout);
    }

    public State state() {
        return state.get();
    }

    public boolean isBusy() {
        return busy.isSet();
    }

    public DescriptorFile descriptorFile() {
        return descriptorFile;
    }

    // IProcessContext

    @Override
    public String name() {
        return name;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public Map<ChannelKind, Integer> ports() {
        synchronized (ports) {
            return Map.copyOf(ports);
        }
    }

    @Override
    public Thread launch(final String purpose, final Task task) {
        return watcher.launch(purpose, task);
    }

    @Override
    public IDataPublisher dataPublisher() {
        final InternalPublisher publisher = publishers.get();
        return packet -> publisher.send(ChannelKind.DATA, MessageCodec.encode(packet));
    }

    @Override
    public void publishEvent(final EventRecord record) {
        publishers.get().send(ChannelKind.EVENT, MessageCodec.encode(record));
    }

    @Override
    public boolean addDataStream(final String address) {
        final Optional<Endpoint> endpoint = Endpoint.parse(address).filter(this::checkTcp);
        if (endpoint.isEmpty()) {
            return false;
        }
        final SubscriberSocket subscriber = new SubscriberSocket(name + "-data-in", settings.highWaterMark());
        subscriber.connect(endpoint.get());
        subscriptions.add(subscriber);
        final Flag stop = stopFlag("data stream " + endpoint.get());
        launch("data stream " + endpoint.get().host() + ":" + endpoint.get().port(),
            () -> receiveStream(subscriber, ChannelKind.DATA, stop, Duration.ZERO));
        LOGGER.info("Added data stream {}", endpoint.get());
        return true;
    }

    @Override
    public synchronized boolean addEventStream(final String address) {
        final Optional<Endpoint> endpoint = Endpoint.parse(address).filter(this::checkTcp);
        if (endpoint.isEmpty()) {
            return false;
        }
        if (eventSubscription == null) {
            eventSubscription = new SubscriberSocket(name + "-event-in", settings.highWaterMark());
            subscriptions.add(eventSubscription);
            final SubscriberSocket subscriber = eventSubscription;
            final Flag stop = stopFlag("event stream");
            launch("event stream", () -> receiveStream(subscriber, ChannelKind.EVENT, stop, settings.eventStreamDelay()));
        }
        eventSubscription.connect(endpoint.get());
        LOGGER.info("Added event stream {}", endpoint.get());
        return true;
    }

    @Override
    public Flag stopFlag(final String purpose) {
        final Flag flag = new Flag();
        stopFlags.add(flag);
        if (stopping.isSet()) {
            flag.set();
        }
        return flag;
    }

    @Override
    public void shutdown() {
        if (!stopping.isSet()) {
            LOGGER.info("Shutting down {}", name);
        }
        stopping.set();
        stopFlags.forEach(Flag::set);
    }

    @Override
    public boolean isStopping() {
        return stopping.isSet();
    }

    // Setup and teardown

    private void setUp() {
        commands = role.commands();

        final PortAllocator allocator = new PortAllocator(
            settings.bindHost(), settings.minPort(), settings.maxPort(), settings.maxTries());
        logSocket = new PublisherSocket(name + "-log", allocator.bindRandomPort(), settings.highWaterMark());
        ports.put(ChannelKind.LOG, logSocket.port());
        cmdSocket = new ReplySocket(name + "-cmd", allocator.bindRandomPort());
        ports.put(ChannelKind.CMD, cmdSocket.port());
        dataSocket = new PublisherSocket(name + "-data", allocator.bindRandomPort(), settings.highWaterMark());
        ports.put(ChannelKind.DATA, dataSocket.port());
        eventSocket = new PublisherSocket(name + "-event", allocator.bindRandomPort(), settings.highWaterMark());
        ports.put(ChannelKind.EVENT, eventSocket.port());

        shutdownHook = new Thread(this::onSignal, name + "-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        descriptorFile.write(ProcessDescriptor.of(pid, name, ports()));

        attachLogChannel();

        final Flag commandStop = stopFlag("command receiver");
        launch("command receiver", () -> receiveCommands(commandStop));
        final Flag bridgeStop = stopFlag("publish bridge");
        launch("publish bridge", () -> bridge(bridgeStop));

        role.attach(this);
    }

    private void watch() {
        try {
            while (!stopping.isSet()) {
                watcher.watch();
                stopping.await(settings.watchInterval());
            }
            state.set(State.STOPPING);
            watcher.joinAll(settings.shutdownTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("{} interrupted while watching its threads", name);
            shutdown();
        }
    }

    private void tearDown() {
        descriptorFile.delete();
        detachLogChannel();
        try {
            role.cleanUp();
        } catch (RuntimeException e) {
            LOGGER.error("Clean up of {} failed: {}", name, e.getMessage(), e);
        }
        subscriptions.forEach(SubscriberSocket::close);
        closeSockets();
        removeShutdownHook();
        if (state.get() != State.FAILED) {
            state.set(State.STOPPED);
        }
        terminated.set();
        LOGGER.info("{} stopped", name);
    }

    private void closeSockets() {
        if (cmdSocket != null) {
            cmdSocket.close();
        }
        for (final PublisherSocket socket : new PublisherSocket[] {logSocket, dataSocket, eventSocket}) {
            if (socket != null) {
                socket.close();
            }
        }
    }

    private void onSignal() {
        LOGGER.info("{} received termination signal", name);
        shutdown();
        try {
            terminated.await(settings.shutdownTimeout().multipliedBy(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down
            LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
        }
    }

    private void attachLogChannel() {
        final Level threshold = Level.toLevel(settings.logChannelLevel(), Level.INFO);
        logAppender = new LogChannelAppender(
            record -> publishers.get().send(ChannelKind.LOG, MessageCodec.encode(record)), threshold);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        logAppender.setContext(context);
        logAppender.start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(logAppender);
    }

    private void detachLogChannel() {
        if (logAppender == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(logAppender);
        logAppender.stop();
    }

    private boolean checkTcp(final Endpoint endpoint) {
        if (!endpoint.isTcp()) {
            LOGGER.error("Upstream stream address must be a tcp address, got {}", endpoint);
            return false;
        }
        return true;
    }

    // Worker loops

    private void receiveCommands(final Flag stop) throws InterruptedException {
        while (!stop.isSet()) {
            if (busy.isSet()) {
                final PendingReply pending = outgoing.poll(settings.stopPoll().toNanos(), TimeUnit.NANOSECONDS);
                if (pending != null) {
                    send(pending);
                }
                continue;
            }
            final ReplySocket.Request request = cmdSocket.poll(settings.commandPoll());
            if (request != null) {
                dispatch(request);
                drainReplies();
            }
        }
        drainReplies();
    }

    private void dispatch(final ReplySocket.Request request) {
        final Command command;
        try {
            command = MessageCodec.decode(request.payload(), Command.class);
        } catch (ProtocolException e) {
            LOGGER.error("Received malformed command: {}", e.getMessage());
            sendNow(request, Reply.error(null, name, e.getMessage()));
            return;
        }
        final List<String> missing = command.missingFields();
        if (!missing.isEmpty()) {
            LOGGER.error("Command is missing required field(s) {}", missing);
            sendNow(request, Reply.error(command.cmd(), name, "Command is missing required field(s) " + missing));
            return;
        }
        final Optional<CommandTable.Entry> entry = commands.resolve(command.target(), command.cmd());
        if (entry.isEmpty()) {
            final String description = commands.hasTarget(command.target())
                ? "Unknown command '" + command.cmd() + "' for target '" + command.target() + "'"
                : "Unknown target '" + command.target() + "'";
            LOGGER.error(description);
            sendNow(request, Reply.error(command.cmd(), name, description));
            return;
        }

        busy.set();
        final CommandContext context = new CommandContext(command, reply -> outgoing.add(new PendingReply(request, reply)));
        try {
            entry.get().handler().handle(context);
        } catch (Exception e) {
            LOGGER.error("Command {}:{} failed: {}", command.target(), command.cmd(), e.getMessage(), e);
            if (!context.isReplied()) {
                context.replyError(e.getMessage() != null ? e.getMessage() : e.toString());
            }
        }
        if (!context.isReplied() && !context.isDeferred()) {
            context.reply(null);
        }
    }

    private void drainReplies() {
        PendingReply pending;
        while ((pending = outgoing.poll()) != null) {
            send(pending);
        }
    }

    private void send(final PendingReply pending) {
        try {
            sendNow(pending.request(), pending.reply());
        } finally {
            busy.clear();
        }
    }

    private void sendNow(final ReplySocket.Request request, final Reply reply) {
        try {
            cmdSocket.reply(request, MessageCodec.encode(reply));
        } catch (TransportException e) {
            LOGGER.warn("Reply to '{}' was not delivered: {}", reply.reply(), e.getMessage());
        }
    }

    private void bridge(final Flag stop) throws InterruptedException {
        while (true) {
            final InternalBus.Message message = bus.poll(settings.stopPoll());
            if (message == null) {
                if (stop.isSet() && watcher.aliveCount() <= 1) {
                    return;
                }
                continue;
            }
            switch (message.channel()) {
                case LOG -> logSocket.send(message.payload());
                case DATA -> dataSocket.send(message.payload());
                case EVENT -> eventSocket.send(message.payload());
                default -> LOGGER.warn("Dropping message for channel '{}'", message.channel());
            }
        }
    }

    private void receiveStream(final SubscriberSocket subscriber, final ChannelKind kind, final Flag stop,
                               final Duration idleDelay) throws InterruptedException {
        while (!stop.isSet()) {
            final String message = subscriber.poll(settings.commandPoll());
            if (message == null) {
                if (!idleDelay.isZero()) {
                    Thread.sleep(idleDelay.toMillis());
                }
                continue;
            }
            if (kind == ChannelKind.DATA) {
                final DataPacket packet;
                try {
                    packet = MessageCodec.decode(message, DataPacket.class);
                } catch (ProtocolException e) {
                    LOGGER.warn("Skipping malformed data packet: {}", e.getMessage());
                    continue;
                }
                final List<DataPacket> derived = role.handleData(packet);
                if (derived != null && !derived.isEmpty()) {
                    final IDataPublisher publisher = dataPublisher();
                    derived.forEach(publisher::publish);
                }
            } else {
                final EventRecord record;
                try {
                    record = MessageCodec.decode(message, EventRecord.class);
                } catch (ProtocolException e) {
                    LOGGER.warn("Skipping malformed event record: {}", e.getMessage());
                    continue;
                }
                role.handleEvent(record);
            }
        }
        subscriber.close();
    }

    private record PendingReply(ReplySocket.Request request, Reply reply) {
    }
}
